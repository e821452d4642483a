package com.flagship.wallet_ledger.ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.wallet_ledger.ledger.TransactionKind;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.store.LedgerChange;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a record is appended to an account's transaction log.
 *
 * The full record is embedded: consumers never need to read it back.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionAppendedEvent implements LedgerEvent {
    UUID eventId;
    String accountId;
    UUID recordId;
    TransactionKind kind;
    BigDecimal amount;
    String counterparty;
    String description;
    Instant recordedAt;
    String originInstanceId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionAppended";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionAppendedEvent from(TransactionRecord record, String originInstanceId) {
        return new TransactionAppendedEvent(
            UUID.randomUUID(),
            record.getAccountId(),
            record.getId(),
            record.getKind(),
            record.getAmount(),
            record.getCounterparty(),
            record.getDescription(),
            record.getTimestamp(),
            originInstanceId,
            Instant.now()
        );
    }

    @Override
    public LedgerChange toChange() {
        return new LedgerChange.RecordAppended(new TransactionRecord(
            recordId, accountId, kind, amount, counterparty, description, recordedAt));
    }
}
