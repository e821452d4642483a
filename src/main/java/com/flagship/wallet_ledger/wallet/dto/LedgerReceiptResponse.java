package com.flagship.wallet_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.LedgerReceipt;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response to a completed deposit or transfer: the caller's new balance and
 * the record added to their history.
 */
@Value
public class LedgerReceiptResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("transaction")
    TransactionResponse transaction;

    public static LedgerReceiptResponse from(LedgerReceipt receipt) {
        return new LedgerReceiptResponse(
            receipt.getBalance().getAccountId(),
            receipt.getBalance().getAmount(),
            TransactionResponse.from(receipt.getRecord()));
    }
}
