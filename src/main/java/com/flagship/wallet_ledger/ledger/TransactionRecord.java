package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Immutable entry of an account's transaction log.
 *
 * Id and timestamp are assigned by the store on append; a draft has neither.
 * Each record is self-contained: rendering it needs no other record.
 */
@Value
public class TransactionRecord {
    UUID id;
    String accountId;
    TransactionKind kind;
    BigDecimal amount;
    String counterparty;
    String description;
    Instant timestamp;

    /**
     * Newest first. A record whose timestamp is not resolved yet sorts as the oldest.
     */
    public static final Comparator<TransactionRecord> NEWEST_FIRST =
        Comparator.comparing(TransactionRecord::effectiveTimestamp).reversed();

    public static TransactionRecord deposit(String accountId, BigDecimal amount) {
        return draft(accountId, TransactionKind.DEPOSIT, amount, null, "Account deposit");
    }

    public static TransactionRecord transferSent(String sender, String recipient, BigDecimal amount) {
        return draft(sender, TransactionKind.TRANSFER_SENT, amount, recipient,
            "Transfer sent to " + recipient);
    }

    public static TransactionRecord transferReceived(String recipient, String sender, BigDecimal amount) {
        return draft(recipient, TransactionKind.TRANSFER_RECEIVED, amount, sender,
            "Transfer received from " + sender);
    }

    private static TransactionRecord draft(String accountId, TransactionKind kind, BigDecimal amount,
                                           String counterparty, String description) {
        return new TransactionRecord(null, accountId, kind, Amounts.requirePositive(amount),
            counterparty, description, null);
    }

    /**
     * Returns the stored form of this draft.
     */
    public TransactionRecord assigned(UUID id, Instant timestamp) {
        if (this.id != null) {
            throw new IllegalStateException("Record " + this.id + " was already appended");
        }
        return new TransactionRecord(id, accountId, kind, amount, counterparty, description, timestamp);
    }

    /**
     * Amount with the sign it has on the balance: positive for credits, negative for debits.
     */
    public BigDecimal signedAmount() {
        return kind.isCredit() ? amount : amount.negate();
    }

    private Instant effectiveTimestamp() {
        return timestamp != null ? timestamp : Instant.EPOCH;
    }

    public static List<TransactionRecord> sortNewestFirst(List<TransactionRecord> records) {
        List<TransactionRecord> sorted = new ArrayList<>(records);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }
}
