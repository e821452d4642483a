package com.flagship.wallet_ledger.ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.wallet_ledger.ledger.AccountBalance;
import com.flagship.wallet_ledger.store.LedgerChange;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when an account balance is created or mutated.
 *
 * Carries the version so consumers can drop values older than the one they hold.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class BalanceChangedEvent implements LedgerEvent {
    UUID eventId;
    String accountId;
    BigDecimal amount;
    long version;
    Instant accountCreatedAt;
    String originInstanceId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceChangedEvent from(AccountBalance balance, String originInstanceId) {
        return new BalanceChangedEvent(
            UUID.randomUUID(),
            balance.getAccountId(),
            balance.getAmount(),
            balance.getVersion(),
            balance.getCreatedAt(),
            originInstanceId,
            Instant.now()
        );
    }

    @Override
    public LedgerChange toChange() {
        return new LedgerChange.BalanceChanged(
            new AccountBalance(accountId, amount, version, accountCreatedAt));
    }
}
