package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.config.AsyncConfig;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.store.Deadline;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for deposits and transfers.
 *
 * Validates input before touching the store, commits the balance change
 * through {@link BalanceRepository}, then writes the log records:
 * 1. The caller's own record synchronously. If it fails the balance change
 *    stands and the caller gets LOG_WRITE_FAILED, which must not be retried
 * 2. The recipient's TRANSFER_RECEIVED record best-effort on a separate
 *    executor. A failure there is logged and counted, never reported
 *
 * With {@code wallet.transfer.atomic-sender-log=true} the sender's record is
 * written in the balance transaction instead, so step 1 cannot fail on its own.
 */
@Service
@Slf4j
public class TransferEngine {

    private final BalanceRepository balances;
    private final TransactionLog transactionLog;
    private final LedgerMetrics metrics;
    private final Executor recipientLogExecutor;
    private final Duration defaultTimeout;
    private final boolean atomicSenderLog;

    public TransferEngine(BalanceRepository balances,
                          TransactionLog transactionLog,
                          LedgerMetrics metrics,
                          @Qualifier(AsyncConfig.RECIPIENT_LOG_EXECUTOR) Executor recipientLogExecutor,
                          @Value("${wallet.operation-timeout:5s}") Duration defaultTimeout,
                          @Value("${wallet.transfer.atomic-sender-log:false}") boolean atomicSenderLog) {
        this.balances = balances;
        this.transactionLog = transactionLog;
        this.metrics = metrics;
        this.recipientLogExecutor = recipientLogExecutor;
        this.defaultTimeout = defaultTimeout;
        this.atomicSenderLog = atomicSenderLog;
    }

    public LedgerReceipt deposit(String accountId, BigDecimal amount) {
        return deposit(accountId, amount, null);
    }

    /**
     * Credits {@code amount} to the account and records a DEPOSIT.
     *
     * @param timeout how long the operation may wait before its store attempt
     *                is submitted; null for the configured default
     */
    public LedgerReceipt deposit(String accountId, BigDecimal amount, Duration timeout) {
        AccountIds.requireWellFormed(accountId);
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId);
        try {
            BigDecimal credited = Amounts.requirePositive(amount);

            AccountBalance balance = balances.deposit(accountId, credited, deadline(timeout));
            TransactionRecord record = appendOwnRecord(TransactionRecord.deposit(accountId, credited));

            log.info("Deposit completed: amount={}, balance={}", credited, balance.getAmount());
            finish("deposit", "success", startTime);
            return new LedgerReceipt(balance, record);

        } catch (LedgerException e) {
            logRejection("Deposit", e);
            finish("deposit", e.getKind().name(), startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    public LedgerReceipt transfer(TransferRequest request) {
        return transfer(request, null);
    }

    /**
     * Moves funds from the sender to the recipient.
     *
     * Checks run in this order and the first failure wins: amount, self
     * transfer, recipient id syntax. No store call is made before all pass.
     */
    public LedgerReceipt transfer(TransferRequest request, Duration timeout) {
        String sender = AccountIds.requireWellFormed(request.getSender());
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, sender);
        try {
            BigDecimal moved = Amounts.requirePositive(request.getAmount());
            if (request.isSelfTransfer()) {
                throw new LedgerException(ErrorKind.SELF_TRANSFER_NOT_ALLOWED, "Sender and recipient are both " + sender);
            }
            String recipient = request.getRecipient();
            if (!AccountIds.isWellFormed(recipient)) {
                throw new LedgerException(ErrorKind.INVALID_RECIPIENT, "Malformed recipient id: " + recipient);
            }

            TransferOutcome outcome = balances.transfer(sender, recipient, moved, deadline(timeout), atomicSenderLog);

            TransactionRecord sent = outcome.hasSentRecord()
                    ? outcome.getSentRecord()
                    : appendOwnRecord(TransactionRecord.transferSent(sender, recipient, moved));

            appendRecipientRecord(TransactionRecord.transferReceived(recipient, sender, moved));

            log.info("Transfer completed: recipient={}, amount={}, balance={}",
                    recipient, moved, outcome.getSender().getAmount());
            finish("transfer", "success", startTime);
            return new LedgerReceipt(outcome.getSender(), sent);

        } catch (LedgerException e) {
            logRejection("Transfer", e);
            finish("transfer", e.getKind().name(), startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private TransactionRecord appendOwnRecord(TransactionRecord draft) {
        try {
            return transactionLog.append(draft);
        } catch (RuntimeException e) {
            log.error("Balance committed but {} record for {} could not be written",
                    draft.getKind(), draft.getAccountId(), e);
            throw new LedgerException(ErrorKind.LOG_WRITE_FAILED,
                    "Balance updated, " + draft.getKind() + " record not written: " + e.getMessage(), e);
        }
    }

    private void appendRecipientRecord(TransactionRecord draft) {
        try {
            recipientLogExecutor.execute(() -> {
                try {
                    transactionLog.append(draft);
                } catch (RuntimeException e) {
                    recipientAppendFailed(draft, e);
                }
            });
        } catch (RejectedExecutionException e) {
            recipientAppendFailed(draft, e);
        }
    }

    private void recipientAppendFailed(TransactionRecord draft, RuntimeException e) {
        log.warn("Could not record received transfer for {} from {} of {}: {}",
                draft.getAccountId(), draft.getCounterparty(), draft.getAmount(), e.getMessage());
        metrics.incrementRecipientAppendFailures();
    }

    private Deadline deadline(Duration timeout) {
        return Deadline.after(timeout != null ? timeout : defaultTimeout);
    }

    private void logRejection(String operation, LedgerException e) {
        switch (e.getKind()) {
            case LOG_WRITE_FAILED, TRANSIENT_STORE_ERROR -> log.error("{} failed: kind={}, detail={}",
                    operation, e.getKind(), e.getMessage());
            default -> log.warn("{} rejected: kind={}, detail={}", operation, e.getKind(), e.getMessage());
        }
    }

    private void finish(String operation, String outcome, long startTime) {
        metrics.recordOperation(operation, outcome.toLowerCase(Locale.ROOT));
        metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
    }
}
