package com.flagship.wallet_ledger.store;

import com.flagship.wallet_ledger.ledger.AccountBalance;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import io.reactivex.Flowable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of balances and transaction logs.
 *
 * Failures are reported as {@link com.flagship.wallet_ledger.ledger.LedgerException}:
 * TRANSIENT_STORE_ERROR when the conflict-retry budget is exhausted or the
 * database is unreachable, TIMEOUT when the deadline passes before an attempt
 * is submitted. A failed call leaves no partial state.
 */
public interface LedgerStore {

    Optional<AccountBalance> findBalance(String accountId);

    /**
     * Creates a zero balance if the account has none. Never overwrites.
     *
     * @return the current balance
     */
    AccountBalance ensureExists(String accountId);

    /**
     * Adds {@code delta} to the balance in one statement, creating the row if absent.
     *
     * @return the balance after the increment
     */
    AccountBalance atomicIncrement(String accountId, BigDecimal delta, Deadline deadline);

    /**
     * Runs {@code work} in one serializable transaction, retrying it on write conflicts.
     * Exceptions thrown by {@code work} roll back and propagate without retry.
     */
    <T> T runTransaction(TransactionWork<T> work, Deadline deadline);

    /**
     * Appends a record, assigning its id and timestamp.
     */
    TransactionRecord append(TransactionRecord draft);

    /**
     * Records of an account in arrival order. No business-time ordering is applied.
     */
    List<TransactionRecord> listRecords(String accountId);

    /**
     * Changes in commit order, emitted after each commit.
     */
    Flowable<LedgerChange> changes();

    @FunctionalInterface
    interface TransactionWork<T> {
        T execute(LedgerTransaction tx);
    }
}
