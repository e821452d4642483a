package com.flagship.wallet_ledger.store;

import com.flagship.wallet_ledger.ledger.AccountBalance;
import com.flagship.wallet_ledger.ledger.TransactionRecord;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Operations available inside {@link LedgerStore#runTransaction}.
 *
 * Everything done through one instance commits together or not at all.
 * Writes are conditional: a row changed by a concurrent transaction since it
 * was read raises a {@link org.springframework.dao.ConcurrencyFailureException},
 * and the store retries the whole unit of work.
 */
public interface LedgerTransaction {

    Optional<AccountBalance> read(String accountId);

    /**
     * Stores a new amount for a balance previously returned by {@link #read}.
     *
     * @return the stored balance with its new version
     */
    AccountBalance write(AccountBalance balance);

    /**
     * Creates the balance row with the given amount.
     * Fails with a conflict if another transaction created it first.
     */
    AccountBalance insertIfAbsent(String accountId, BigDecimal amount);

    /**
     * Appends a log record as part of this transaction.
     */
    TransactionRecord append(TransactionRecord draft);
}
