package com.flagship.wallet_ledger.notification;

import com.flagship.wallet_ledger.ledger.BalanceRepository;
import com.flagship.wallet_ledger.ledger.TransactionKind;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.ledger.TransferEngine;
import com.flagship.wallet_ledger.ledger.TransferRequest;
import io.reactivex.subscribers.TestSubscriber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Subscribers see committed changes from the real store.
 */
@SpringBootTest
@Testcontainers
class NotificationFanoutTest {

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
    private NotificationFanout fanout;

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private BalanceRepository balanceRepository;

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
    @DisplayName("Balance subscriber sees 0.00 for a new account, then the deposit")
    void testBalanceStream_NewAccountThenDeposit() {
        printTestHeader("Balance Stream");
        String account = newAccount();

        TestSubscriber<BigDecimal> subscriber = fanout.subscribeBalance(account).test();
        subscriber.awaitCount(1);
        subscriber.assertValues(new BigDecimal("0.00"));

        transferEngine.deposit(account, new BigDecimal("100"));

        subscriber.awaitCount(2);
        subscriber.assertValues(new BigDecimal("0.00"), new BigDecimal("100.00"));
        subscriber.dispose();
        printSuccess("Stream emitted 0.00 then 100.00");
    }

    @Test
    @DisplayName("Subscribing to the balance of a new account initializes it at zero")
    void testBalanceStream_InitializesAccount() {
        printTestHeader("Balance Subscription Initializes Account");
        String account = newAccount();

        TestSubscriber<BigDecimal> subscriber = fanout.subscribeBalance(account).test();
        subscriber.awaitCount(1);

        assertEquals(new BigDecimal("0.00"), balanceRepository.getBalance(account));
        assertEquals(0L, balanceRepository.ensureInitialized(account).getVersion());
        subscriber.dispose();
        printSuccess("Account row exists with version 0");
    }

    @Test
    @DisplayName("Both parties of a transfer are notified")
    void testBalanceStream_Transfer() {
        printTestHeader("Transfer Notifies Both Parties");
        String alice = newAccount();
        String bob = newAccount();
        transferEngine.deposit(alice, new BigDecimal("100"));

        TestSubscriber<BigDecimal> aliceStream = fanout.subscribeBalance(alice).test();
        TestSubscriber<BigDecimal> bobStream = fanout.subscribeBalance(bob).test();
        aliceStream.awaitCount(1);
        bobStream.awaitCount(1);

        transferEngine.transfer(TransferRequest.of(alice, bob, new BigDecimal("40")));

        aliceStream.awaitCount(2);
        bobStream.awaitCount(2);
        aliceStream.assertValues(new BigDecimal("100.00"), new BigDecimal("60.00"));
        bobStream.assertValues(new BigDecimal("0.00"), new BigDecimal("40.00"));
        aliceStream.dispose();
        bobStream.dispose();
        printSuccess("Alice 100.00 -> 60.00, Bob 0.00 -> 40.00");
    }

    @Test
    @DisplayName("Log subscriber gets existing records, then new ones as they are appended")
    void testTransactionStream_SnapshotThenLive() {
        printTestHeader("Transaction Stream");
        String alice = newAccount();
        String bob = newAccount();
        transferEngine.deposit(alice, new BigDecimal("100"));

        TestSubscriber<TransactionRecord> subscriber = fanout.subscribeTransactions(alice).test();
        subscriber.awaitCount(1);

        transferEngine.transfer(TransferRequest.of(alice, bob, new BigDecimal("40")));
        subscriber.awaitCount(2);

        subscriber.assertValueCount(2);
        assertEquals(TransactionKind.DEPOSIT, subscriber.values().get(0).getKind());
        assertEquals(TransactionKind.TRANSFER_SENT, subscriber.values().get(1).getKind());

        subscriber.dispose();
        printSuccess("DEPOSIT from the snapshot, TRANSFER_SENT live");
    }

    @Test
    @DisplayName("Cancelled subscriptions release their channel")
    void testChannelsReleased() {
        printTestHeader("Channels Released");
        String account = newAccount();
        int before = fanout.openChannels();

        TestSubscriber<BigDecimal> balance = fanout.subscribeBalance(account).test();
        TestSubscriber<TransactionRecord> records = fanout.subscribeTransactions(account).test();
        assertEquals(before + 2, fanout.openChannels());

        balance.dispose();
        records.dispose();
        assertEquals(before, fanout.openChannels());
        printSuccess("Open channels back to " + before);
    }
}
