package com.flagship.wallet_ledger.ledger;

import lombok.Value;

/**
 * What the caller gets back from a completed deposit or transfer:
 * their own balance after the commit and the record written to their log.
 */
@Value
public class LedgerReceipt {
    AccountBalance balance;
    TransactionRecord record;
}
