package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.store.Deadline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Transfer engine behaviour around the store: validation order, log write
 * failures and the best-effort recipient record. The store is mocked.
 */
class TransferEngineValidationTest {

    private BalanceRepository balances;
    private TransactionLog transactionLog;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        balances = mock(BalanceRepository.class);
        transactionLog = mock(TransactionLog.class);
        registry = new SimpleMeterRegistry();
        when(transactionLog.append(any())).thenAnswer(invocation -> {
            TransactionRecord draft = invocation.getArgument(0);
            return draft.assigned(UUID.randomUUID(), Instant.now());
        });
    }

    private TransferEngine engine(Executor executor, boolean atomicSenderLog) {
        return new TransferEngine(balances, transactionLog, new LedgerMetrics(registry),
                executor, Duration.ofSeconds(5), atomicSenderLog);
    }

    private TransferEngine engine() {
        return engine(Runnable::run, false);
    }

    private static AccountBalance balance(String accountId, String amount, long version) {
        return new AccountBalance(accountId, new BigDecimal(amount), version, Instant.now());
    }

    @Test
    @DisplayName("Invalid amount is reported before a self transfer")
    void testValidationOrder_AmountFirst() {
        LedgerException e = assertThrows(LedgerException.class,
                () -> engine().transfer(TransferRequest.of("alice", "alice", new BigDecimal("-1"))));

        assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
        verifyNoInteractions(balances, transactionLog);
    }

    @Test
    @DisplayName("Self transfer is reported before a malformed recipient")
    void testValidationOrder_SelfBeforeRecipient() {
        LedgerException self = assertThrows(LedgerException.class,
                () -> engine().transfer(TransferRequest.of("alice", "alice", BigDecimal.TEN)));
        assertEquals(ErrorKind.SELF_TRANSFER_NOT_ALLOWED, self.getKind());

        LedgerException recipient = assertThrows(LedgerException.class,
                () -> engine().transfer(TransferRequest.of("alice", "not valid!", BigDecimal.TEN)));
        assertEquals(ErrorKind.INVALID_RECIPIENT, recipient.getKind());

        LedgerException empty = assertThrows(LedgerException.class,
                () -> engine().transfer(TransferRequest.of("alice", "", BigDecimal.TEN)));
        assertEquals(ErrorKind.INVALID_RECIPIENT, empty.getKind());

        verifyNoInteractions(balances, transactionLog);
    }

    @Test
    @DisplayName("Transfer writes the sender record and the recipient record")
    void testTransfer_WritesBothRecords() {
        when(balances.transfer(eq("alice"), eq("bob"), any(), any(Deadline.class), eq(false)))
                .thenReturn(new TransferOutcome(balance("alice", "60.00", 2), balance("bob", "40.00", 1), null));

        LedgerReceipt receipt = engine().transfer(TransferRequest.of("alice", "bob", new BigDecimal("40")));

        assertEquals(new BigDecimal("60.00"), receipt.getBalance().getAmount());
        assertEquals(TransactionKind.TRANSFER_SENT, receipt.getRecord().getKind());
        verify(transactionLog).append(argThat(r ->
                r.getKind() == TransactionKind.TRANSFER_RECEIVED && "bob".equals(r.getAccountId())));
        assertEquals(1.0, registry.counter("ledger.operations",
                "operation", "transfer", "outcome", "success").count());
    }

    @Test
    @DisplayName("Failing sender record surfaces LOG_WRITE_FAILED after the balance committed")
    void testTransfer_SenderRecordFails() {
        when(balances.transfer(anyString(), anyString(), any(), any(Deadline.class), anyBoolean()))
                .thenReturn(new TransferOutcome(balance("alice", "60.00", 2), balance("bob", "40.00", 1), null));
        doThrow(new IllegalStateException("log table unavailable"))
                .when(transactionLog).append(argThat(r -> r != null && r.getKind() == TransactionKind.TRANSFER_SENT));

        LedgerException e = assertThrows(LedgerException.class,
                () -> engine().transfer(TransferRequest.of("alice", "bob", new BigDecimal("40"))));

        assertEquals(ErrorKind.LOG_WRITE_FAILED, e.getKind());
        assertFalse(e.isRetryable());
        verify(balances).transfer(anyString(), anyString(), any(), any(Deadline.class), anyBoolean());
    }

    @Test
    @DisplayName("Failing recipient record is counted but not reported")
    void testTransfer_RecipientRecordFails() {
        when(balances.transfer(anyString(), anyString(), any(), any(Deadline.class), anyBoolean()))
                .thenReturn(new TransferOutcome(balance("alice", "60.00", 2), balance("bob", "40.00", 1), null));
        doThrow(new IllegalStateException("log table unavailable"))
                .when(transactionLog).append(argThat(r -> r != null && r.getKind() == TransactionKind.TRANSFER_RECEIVED));

        LedgerReceipt receipt = engine().transfer(TransferRequest.of("alice", "bob", new BigDecimal("40")));

        assertEquals(TransactionKind.TRANSFER_SENT, receipt.getRecord().getKind());
        assertEquals(1.0, registry.counter("ledger.log.recipient_append_failures").count());
    }

    @Test
    @DisplayName("A saturated recipient executor is counted but not reported")
    void testTransfer_RecipientExecutorRejects() {
        when(balances.transfer(anyString(), anyString(), any(), any(Deadline.class), anyBoolean()))
                .thenReturn(new TransferOutcome(balance("alice", "60.00", 2), balance("bob", "40.00", 1), null));
        Executor rejecting = task -> {
            throw new RejectedExecutionException("queue full");
        };

        LedgerReceipt receipt = engine(rejecting, false)
                .transfer(TransferRequest.of("alice", "bob", new BigDecimal("40")));

        assertNotNull(receipt.getRecord());
        assertEquals(1.0, registry.counter("ledger.log.recipient_append_failures").count());
    }

    @Test
    @DisplayName("Atomic sender log uses the record written with the balances")
    void testTransfer_AtomicSenderLog() {
        TransactionRecord sent = TransactionRecord.transferSent("alice", "bob", new BigDecimal("40"))
                .assigned(UUID.randomUUID(), Instant.now());
        when(balances.transfer(anyString(), anyString(), any(), any(Deadline.class), eq(true)))
                .thenReturn(new TransferOutcome(balance("alice", "60.00", 2), balance("bob", "40.00", 1), sent));

        LedgerReceipt receipt = engine(Runnable::run, true)
                .transfer(TransferRequest.of("alice", "bob", new BigDecimal("40")));

        assertSame(sent, receipt.getRecord());
        verify(transactionLog, never()).append(argThat(r -> r != null && r.getKind() == TransactionKind.TRANSFER_SENT));
    }

    @Test
    @DisplayName("Insufficient funds propagate and no record is written")
    void testTransfer_InsufficientFunds() {
        when(balances.transfer(anyString(), anyString(), any(), any(Deadline.class), anyBoolean()))
                .thenThrow(new LedgerException(ErrorKind.INSUFFICIENT_FUNDS, "alice has 0.00"));

        LedgerException e = assertThrows(LedgerException.class,
                () -> engine().transfer(TransferRequest.of("alice", "bob", new BigDecimal("40"))));

        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, e.getKind());
        verifyNoInteractions(transactionLog);
        assertEquals(1.0, registry.counter("ledger.operations",
                "operation", "transfer", "outcome", "insufficient_funds").count());
    }

    @Test
    @DisplayName("Deposit rejects an invalid amount without touching the store")
    void testDeposit_InvalidAmount() {
        LedgerException e = assertThrows(LedgerException.class,
                () -> engine().deposit("alice", new BigDecimal("0.001")));

        assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
        verifyNoInteractions(balances, transactionLog);
    }
}
