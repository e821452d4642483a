package com.flagship.wallet_ledger.ledger;

import lombok.Value;

/**
 * Balances of both parties right after a transfer committed.
 *
 * {@code sentRecord} is set when the sender's log record was written in the
 * same transaction as the balances, and null otherwise.
 */
@Value
public class TransferOutcome {
    AccountBalance sender;
    AccountBalance recipient;
    TransactionRecord sentRecord;

    public boolean hasSentRecord() {
        return sentRecord != null;
    }
}
