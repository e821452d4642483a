package com.flagship.wallet_ledger.store;

import com.flagship.wallet_ledger.ledger.ErrorKind;
import com.flagship.wallet_ledger.ledger.LedgerException;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retry loop around store attempts.
 *
 * Write conflicts (concurrent update, serialization failure, deadlock) are
 * retried with exponential backoff until the attempt budget is spent.
 * Connectivity failures are not retried here: the caller may retry the whole
 * operation. Both end as TRANSIENT_STORE_ERROR.
 */
@Component
@Slf4j
public class StoreRetryPolicy {

    private static final String SERIALIZATION_FAILURE = "40001";
    private static final String DEADLOCK_DETECTED = "40P01";
    private static final String NUMERIC_OUT_OF_RANGE = "22003";

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final LedgerMetrics metrics;

    public StoreRetryPolicy(
            @Value("${ledger.store.retry.max-attempts:5}") int maxAttempts,
            @Value("${ledger.store.retry.initial-backoff-ms:20}") long initialBackoffMs,
            @Value("${ledger.store.retry.multiplier:2.0}") double multiplier,
            @Value("${ledger.store.retry.max-backoff-ms:1000}") long maxBackoffMs,
            LedgerMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("ledger.store.retry.max-attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Duration.ofMillis(initialBackoffMs);
        this.multiplier = multiplier;
        this.maxBackoff = Duration.ofMillis(maxBackoffMs);
        this.metrics = metrics;
    }

    /**
     * Runs {@code attempt} until it succeeds, fails with a non-conflict error,
     * or the budget or deadline is exhausted.
     *
     * @param operation name used in log messages
     */
    public <T> T execute(String operation, Deadline deadline, Supplier<T> attempt) {
        Duration backoff = initialBackoff;
        for (int attemptNumber = 1; ; attemptNumber++) {
            if (deadline.isExpired()) {
                log.warn("Store {} abandoned before attempt {}: deadline passed", operation, attemptNumber);
                throw new LedgerException(ErrorKind.TIMEOUT,
                        "Deadline passed before " + operation + " was submitted");
            }
            try {
                return attempt.get();
            } catch (LedgerException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!isWriteConflict(e)) {
                    if (hasSqlState(e, NUMERIC_OUT_OF_RANGE)) {
                        log.warn("Store {} rejected: amount out of range for the balance column", operation);
                        throw new LedgerException(ErrorKind.INVALID_AMOUNT,
                                "Resulting balance exceeds the supported range", e);
                    }
                    if (isConnectivityFailure(e)) {
                        log.error("Store {} failed, database unavailable: {}", operation, e.getMessage());
                        throw new LedgerException(ErrorKind.TRANSIENT_STORE_ERROR,
                                "Ledger store unavailable during " + operation, e);
                    }
                    throw e;
                }
                if (attemptNumber >= maxAttempts) {
                    log.error("Store {} gave up after {} conflicting attempts", operation, attemptNumber);
                    throw new LedgerException(ErrorKind.TRANSIENT_STORE_ERROR,
                            String.format("Write conflict on %s not resolved after %d attempts",
                                    operation, attemptNumber), e);
                }
                log.debug("Store {} attempt {} hit a write conflict, retrying in {}ms: {}",
                        operation, attemptNumber, backoff.toMillis(), e.getMessage());
                metrics.incrementStoreRetries();
                sleep(backoff, operation);
                backoff = nextBackoff(backoff);
            }
        }
    }

    private Duration nextBackoff(Duration current) {
        long next = (long) (current.toMillis() * multiplier);
        return next > maxBackoff.toMillis() ? maxBackoff : Duration.ofMillis(next);
    }

    private void sleep(Duration backoff, String operation) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerException(ErrorKind.TIMEOUT,
                    "Interrupted while waiting to retry " + operation, e);
        }
    }

    /**
     * Conflicts may surface as translated Spring exceptions at statement time,
     * or wrapped in a commit failure carrying the SQL state.
     */
    static boolean isWriteConflict(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConcurrencyFailureException) {
                return true;
            }
            if (cause instanceof SQLException sqlException) {
                String state = sqlException.getSQLState();
                if (SERIALIZATION_FAILURE.equals(state) || DEADLOCK_DETECTED.equals(state)) {
                    return true;
                }
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    static boolean hasSqlState(Throwable e, String sqlState) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sqlException && sqlState.equals(sqlException.getSQLState())) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    static boolean isConnectivityFailure(Throwable e) {
        return e instanceof DataAccessResourceFailureException
                || e instanceof CannotCreateTransactionException
                || e instanceof TransientDataAccessException;
    }
}
