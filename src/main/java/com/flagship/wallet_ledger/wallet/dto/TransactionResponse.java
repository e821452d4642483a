package com.flagship.wallet_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.TransactionKind;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One transaction log entry as shown to its owner.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("amount")
    BigDecimal amount;

    // positive for credits, negative for debits
    @JsonProperty("signed_amount")
    BigDecimal signedAmount;

    @JsonProperty("counterparty")
    String counterparty;

    @JsonProperty("description")
    String description;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static TransactionResponse from(TransactionRecord record) {
        return TransactionResponse.builder()
            .id(record.getId())
            .kind(record.getKind())
            .amount(record.getAmount())
            .signedAmount(record.signedAmount())
            .counterparty(record.getCounterparty())
            .description(record.getDescription())
            .timestamp(record.getTimestamp())
            .build();
    }
}
