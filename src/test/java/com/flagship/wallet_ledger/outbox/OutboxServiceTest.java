package com.flagship.wallet_ledger.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.ledger.AccountBalance;
import com.flagship.wallet_ledger.ledger.LedgerException;
import com.flagship.wallet_ledger.ledger.TransferEngine;
import com.flagship.wallet_ledger.ledger.TransferRequest;
import com.flagship.wallet_ledger.ledger.event.BalanceChangedEvent;
import com.flagship.wallet_ledger.ledger.event.TransactionAppendedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger changes and their outbox events commit together:
 * - every committed balance change and record has an event
 * - a rolled back transfer leaves no event behind
 * - delivery bookkeeping tracks attempts and publication
 */
@SpringBootTest
@Testcontainers
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wallet_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
    }

    private static String newAccount() {
        return "acc-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("A deposit leaves a balance event and a record event, in commit order")
    void testDeposit_WritesEvents() throws Exception {
        printTestHeader("Deposit Writes Outbox Events");
        String account = newAccount();

        transferEngine.deposit(account, new BigDecimal("100"));

        List<OutboxEvent> events = outboxService.eventsForAccount(account);
        assertEquals(List.of(BalanceChangedEvent.EVENT_TYPE, TransactionAppendedEvent.EVENT_TYPE),
                events.stream().map(OutboxEvent::getEventType).toList());
        events.forEach(event -> {
            assertEquals(OutboxEvent.ACCOUNT_AGGREGATE, event.getAggregateType());
            assertFalse(event.isPublished());
            assertEquals(0, event.getAttempts());
        });
        assertTrue(events.get(0).getSequenceNumber() < events.get(1).getSequenceNumber());

        BalanceChangedEvent balance = objectMapper.readValue(events.get(0).getPayload(), BalanceChangedEvent.class);
        assertEquals(events.get(0).getId(), balance.getEventId());
        assertEquals(account, balance.getAccountId());
        assertEquals(0, new BigDecimal("100.00").compareTo(balance.getAmount()));
        assertEquals(1L, balance.getVersion());

        printSuccess("BalanceChanged then TransactionAppended, outbox id = event id");
    }

    @Test
    @DisplayName("A rejected transfer writes no events")
    void testRejectedTransfer_NoEvents() {
        printTestHeader("Rejected Transfer Writes Nothing");
        String alice = newAccount();
        String bob = newAccount();
        transferEngine.deposit(alice, new BigDecimal("10"));
        int before = outboxService.eventsForAccount(alice).size();

        assertThrows(LedgerException.class,
                () -> transferEngine.transfer(TransferRequest.of(alice, bob, new BigDecimal("1000"))));

        assertEquals(before, outboxService.eventsForAccount(alice).size());
        assertTrue(outboxService.eventsForAccount(bob).isEmpty());
        printSuccess("No outbox rows for the rolled back transfer");
    }

    @Test
    @DisplayName("Recording outside a transaction is refused")
    void testRecord_RequiresTransaction() {
        printTestHeader("Record Requires Transaction");
        BalanceChangedEvent event = BalanceChangedEvent.from(
                new AccountBalance(newAccount(), new BigDecimal("1.00"), 1L, Instant.now()), "test-instance");

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.record(event));
        printSuccess("MANDATORY propagation enforced");
    }

    @Test
    @DisplayName("Failed attempts are counted and exhausted events are no longer pending")
    void testMarkFailed_ExhaustsEvent() {
        printTestHeader("Failed Attempts Exhaust Event");
        String account = newAccount();
        transferEngine.deposit(account, new BigDecimal("5"));
        OutboxEvent first = outboxService.eventsForAccount(account).get(0);

        outboxService.markFailed(first.getId(), "broker down");
        outboxService.markFailed(first.getId(), "broker down");

        OutboxEvent failed = outboxService.eventsForAccount(account).get(0);
        assertEquals(2, failed.getAttempts());
        assertEquals("broker down", failed.getLastError());
        assertTrue(failed.hasExhausted(2));

        List<UUID> pendingWithLimit2 = outboxService.findPending(100, 2).stream().map(OutboxEvent::getId).toList();
        List<UUID> pendingWithLimit5 = outboxService.findPending(100, 5).stream().map(OutboxEvent::getId).toList();
        assertFalse(pendingWithLimit2.contains(first.getId()));
        assertTrue(pendingWithLimit5.contains(first.getId()));
        printSuccess("Event left out once it reached the attempt limit");
    }

    @Test
    @DisplayName("Published events leave the backlog and are purged after retention")
    void testMarkPublished_ThenPurge() {
        printTestHeader("Publish And Purge");
        String account = newAccount();
        transferEngine.deposit(account, new BigDecimal("5"));
        List<OutboxEvent> events = outboxService.eventsForAccount(account);

        events.forEach(event -> outboxService.markPublished(event.getId()));

        assertEquals(0, outboxService.countUnpublished());
        assertTrue(outboxService.eventsForAccount(account).stream().allMatch(OutboxEvent::isPublished));

        assertEquals(0, outboxService.purgePublishedBefore(Instant.now().minusSeconds(3600)));
        assertEquals(events.size(), outboxService.purgePublishedBefore(Instant.now().plusSeconds(1)));
        assertTrue(outboxService.eventsForAccount(account).isEmpty());
        printSuccess("Backlog empty, published rows purged");
    }
}
