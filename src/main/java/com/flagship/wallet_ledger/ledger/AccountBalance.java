package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Current balance of one account.
 *
 * Invariant: amount is never negative. The version grows by one on every
 * mutation, so two snapshots of the same account can be ordered.
 */
@Value
public class AccountBalance {
    String accountId;
    BigDecimal amount;
    long version;
    Instant createdAt;

    public static AccountBalance empty(String accountId) {
        return new AccountBalance(accountId, Amounts.ZERO, 0L, null);
    }

    public boolean covers(BigDecimal requested) {
        return amount.compareTo(requested) >= 0;
    }

    /**
     * Returns the balance after adding {@code delta} (negative to withdraw).
     *
     * @throws IllegalStateException if the result would be negative
     */
    public AccountBalance plus(BigDecimal delta) {
        BigDecimal next = amount.add(delta);
        if (next.signum() < 0) {
            throw new IllegalStateException(
                String.format("Balance of %s cannot go negative: %s + %s", accountId, amount, delta));
        }
        return new AccountBalance(accountId, Amounts.normalize(next), version, createdAt);
    }
}
