package com.flagship.wallet_ledger.store;

import com.flagship.wallet_ledger.ledger.AccountBalance;
import com.flagship.wallet_ledger.ledger.TransactionKind;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.outbox.LedgerChangeJournal;
import io.reactivex.BackpressureStrategy;
import io.reactivex.Flowable;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed ledger store.
 *
 * Multi-row units of work run SERIALIZABLE; single-statement operations run
 * READ COMMITTED and rely on the row lock taken by the statement. Every
 * committed change is written to the outbox inside the same transaction and
 * emitted on {@link #changes()} once the commit returns.
 */
@Component
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String SELECT_BALANCE =
            "SELECT account_id, amount, version, created_at FROM account_balances WHERE account_id = ?";

    private static final String UPDATE_BALANCE = """
            UPDATE account_balances
            SET amount = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP
            WHERE account_id = ? AND version = ?
            RETURNING account_id, amount, version, created_at""";

    private static final String INSERT_BALANCE = """
            INSERT INTO account_balances (account_id, amount, version, created_at, updated_at)
            VALUES (?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (account_id) DO NOTHING
            RETURNING account_id, amount, version, created_at""";

    private static final String INCREMENT_BALANCE = """
            INSERT INTO account_balances (account_id, amount, version, created_at, updated_at)
            VALUES (?, ?, 1, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (account_id) DO UPDATE
            SET amount = account_balances.amount + EXCLUDED.amount,
                version = account_balances.version + 1,
                updated_at = CURRENT_TIMESTAMP
            RETURNING account_id, amount, version, created_at""";

    private static final String INSERT_RECORD = """
            INSERT INTO transaction_records (id, account_id, kind, amount, counterparty, description)
            VALUES (?, ?, ?, ?, ?, ?)
            RETURNING recorded_at""";

    private static final String SELECT_RECORDS = """
            SELECT id, account_id, kind, amount, counterparty, description, recorded_at
            FROM transaction_records
            WHERE account_id = ?
            ORDER BY arrival_seq""";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate serializable;
    private final TransactionTemplate readCommitted;
    private final StoreRetryPolicy retryPolicy;
    private final LedgerChangeJournal journal;

    private final Subject<LedgerChange> committedChanges = PublishSubject.<LedgerChange>create().toSerialized();

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate,
                           PlatformTransactionManager transactionManager,
                           StoreRetryPolicy retryPolicy,
                           LedgerChangeJournal journal) {
        this.jdbcTemplate = jdbcTemplate;
        this.retryPolicy = retryPolicy;
        this.journal = journal;

        this.serializable = new TransactionTemplate(transactionManager);
        this.serializable.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
        this.serializable.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.readCommitted = new TransactionTemplate(transactionManager);
        this.readCommitted.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.readCommitted.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Optional<AccountBalance> findBalance(String accountId) {
        return retryPolicy.execute("findBalance", Deadline.none(),
                () -> jdbcTemplate.query(SELECT_BALANCE, BALANCE_MAPPER, accountId).stream().findFirst());
    }

    @Override
    public AccountBalance ensureExists(String accountId) {
        return retryPolicy.execute("ensureExists", Deadline.none(), () -> readCommitted.execute(status -> {
            jdbcTemplate.query(INSERT_BALANCE, BALANCE_MAPPER, accountId, BigDecimal.ZERO, 0L);
            return jdbcTemplate.queryForObject(SELECT_BALANCE, BALANCE_MAPPER, accountId);
        }));
    }

    @Override
    public AccountBalance atomicIncrement(String accountId, BigDecimal delta, Deadline deadline) {
        return inTransaction("atomicIncrement", readCommitted, deadline, tx -> tx.increment(accountId, delta));
    }

    @Override
    public <T> T runTransaction(TransactionWork<T> work, Deadline deadline) {
        return inTransaction("runTransaction", serializable, deadline, work::execute);
    }

    @Override
    public TransactionRecord append(TransactionRecord draft) {
        return inTransaction("append", readCommitted, Deadline.none(), tx -> tx.append(draft));
    }

    @Override
    public List<TransactionRecord> listRecords(String accountId) {
        return retryPolicy.execute("listRecords", Deadline.none(),
                () -> jdbcTemplate.query(SELECT_RECORDS, RECORD_MAPPER, accountId));
    }

    @Override
    public Flowable<LedgerChange> changes() {
        return committedChanges.toFlowable(BackpressureStrategy.BUFFER);
    }

    @PreDestroy
    public void close() {
        committedChanges.onComplete();
    }

    private <T> T inTransaction(String operation, TransactionTemplate template, Deadline deadline,
                                Work<T> work) {
        return retryPolicy.execute(operation, deadline, () -> {
            // a fresh transaction per attempt, so a retried attempt starts with no recorded changes
            JdbcLedgerTransaction tx = new JdbcLedgerTransaction();
            T result = template.execute(status -> {
                T value = work.apply(tx);
                journal.record(tx.changes);
                return value;
            });
            emit(tx.changes);
            return result;
        });
    }

    private void emit(List<LedgerChange> changes) {
        for (LedgerChange change : changes) {
            try {
                committedChanges.onNext(change);
            } catch (RuntimeException e) {
                log.error("Listener failed on committed change for account {}", change.getAccountId(), e);
            }
        }
    }

    @FunctionalInterface
    private interface Work<T> {
        T apply(JdbcLedgerTransaction tx);
    }

    private class JdbcLedgerTransaction implements LedgerTransaction {

        private final List<LedgerChange> changes = new ArrayList<>();

        @Override
        public Optional<AccountBalance> read(String accountId) {
            return jdbcTemplate.query(SELECT_BALANCE, BALANCE_MAPPER, accountId).stream().findFirst();
        }

        @Override
        public AccountBalance write(AccountBalance balance) {
            AccountBalance stored = jdbcTemplate.query(UPDATE_BALANCE, BALANCE_MAPPER,
                            balance.getAmount(), balance.getAccountId(), balance.getVersion())
                    .stream()
                    .findFirst()
                    .orElseThrow(() -> new OptimisticLockingFailureException(
                            "Balance of " + balance.getAccountId() + " changed since version " + balance.getVersion()));
            changes.add(new LedgerChange.BalanceChanged(stored));
            return stored;
        }

        @Override
        public AccountBalance insertIfAbsent(String accountId, BigDecimal amount) {
            AccountBalance stored = jdbcTemplate.query(INSERT_BALANCE, BALANCE_MAPPER, accountId, amount, 1L)
                    .stream()
                    .findFirst()
                    .orElseThrow(() -> new OptimisticLockingFailureException(
                            "Balance of " + accountId + " was created concurrently"));
            changes.add(new LedgerChange.BalanceChanged(stored));
            return stored;
        }

        AccountBalance increment(String accountId, BigDecimal delta) {
            AccountBalance stored = jdbcTemplate.queryForObject(INCREMENT_BALANCE, BALANCE_MAPPER, accountId, delta);
            changes.add(new LedgerChange.BalanceChanged(stored));
            return stored;
        }

        @Override
        public TransactionRecord append(TransactionRecord draft) {
            UUID id = UUID.randomUUID();
            Timestamp recordedAt = jdbcTemplate.queryForObject(INSERT_RECORD, Timestamp.class,
                    id,
                    draft.getAccountId(),
                    draft.getKind().name(),
                    draft.getAmount(),
                    draft.getCounterparty(),
                    draft.getDescription());
            TransactionRecord stored = draft.assigned(id, recordedAt != null ? recordedAt.toInstant() : null);
            changes.add(new LedgerChange.RecordAppended(stored));
            return stored;
        }
    }

    private static final RowMapper<AccountBalance> BALANCE_MAPPER = (rs, rowNum) -> new AccountBalance(
            rs.getString("account_id"),
            rs.getBigDecimal("amount"),
            rs.getLong("version"),
            toInstant(rs.getTimestamp("created_at")));

    private static final RowMapper<TransactionRecord> RECORD_MAPPER = (rs, rowNum) -> new TransactionRecord(
            rs.getObject("id", UUID.class),
            rs.getString("account_id"),
            TransactionKind.valueOf(rs.getString("kind")),
            rs.getBigDecimal("amount"),
            rs.getString("counterparty"),
            rs.getString("description"),
            toInstant(rs.getTimestamp("recorded_at")));

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
