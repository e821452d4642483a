package com.flagship.wallet_ledger.notification;

import com.flagship.wallet_ledger.ledger.AccountBalance;
import com.flagship.wallet_ledger.ledger.AccountIds;
import com.flagship.wallet_ledger.ledger.BalanceRepository;
import com.flagship.wallet_ledger.ledger.TransactionLog;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.store.LedgerChange;
import com.flagship.wallet_ledger.store.LedgerStore;
import io.reactivex.BackpressureStrategy;
import io.reactivex.Flowable;
import io.reactivex.disposables.Disposable;
import io.reactivex.processors.UnicastProcessor;
import io.reactivex.subjects.BehaviorSubject;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Pushes balance and transaction-log changes to subscribers of an account.
 *
 * Every subscription starts with a snapshot read from the store, then follows
 * the committed changes of that account:
 * - balance streams may skip intermediate values but never go back to an
 *   older one (changes carry the row version, older versions are dropped)
 * - log streams deliver every record once, including records appended while
 *   the snapshot was being read
 *
 * Changes arrive from the local store and, through {@link #publish}, from the
 * Kafka relay for changes committed by other instances. One channel exists per
 * account with at least one subscriber; it is released with the last one.
 */
@Service
@Slf4j
public class NotificationFanout {

    static final long RESUBSCRIBE_DELAY_MS = 1000;

    private final LedgerStore store;
    private final BalanceRepository balances;
    private final TransactionLog transactionLog;
    private final LedgerMetrics metrics;

    private final ConcurrentHashMap<String, BalanceChannel> balanceChannels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RecordChannel> recordChannels = new ConcurrentHashMap<>();
    private final AtomicInteger balanceSubscribers = new AtomicInteger();
    private final AtomicInteger recordSubscribers = new AtomicInteger();

    private Disposable storeSubscription;

    public NotificationFanout(LedgerStore store,
                              BalanceRepository balances,
                              TransactionLog transactionLog,
                              LedgerMetrics metrics) {
        this.store = store;
        this.balances = balances;
        this.transactionLog = transactionLog;
        this.metrics = metrics;
    }

    @PostConstruct
    public void start() {
        storeSubscription = store.changes()
                .doOnError(error -> log.error("Store change stream failed, resubscribing in {}ms",
                        RESUBSCRIBE_DELAY_MS, error))
                .retryWhen(errors -> errors.delay(RESUBSCRIBE_DELAY_MS, TimeUnit.MILLISECONDS))
                .subscribe(
                        this::deliver,
                        error -> log.error("Store change stream ended, notifications stopped", error));
        metrics.registerSubscriptionGauge("balance", balanceSubscribers::get);
        metrics.registerSubscriptionGauge("transactions", recordSubscribers::get);
    }

    @PreDestroy
    public void stop() {
        if (storeSubscription != null) {
            storeSubscription.dispose();
        }
        balanceChannels.values().forEach(channel -> channel.subject.onComplete());
        recordChannels.values().forEach(channel -> channel.subject.onComplete());
        balanceChannels.clear();
        recordChannels.clear();
    }

    /**
     * Current balance first, then every newer committed balance.
     *
     * Subscribing initializes the account at zero if it has no balance yet.
     */
    public Flowable<BigDecimal> subscribeBalance(String accountId) {
        AccountIds.requireWellFormed(accountId);
        return Flowable.defer(() -> {
            BalanceChannel channel = balanceChannels.compute(accountId, (id, existing) -> {
                BalanceChannel c = existing != null ? existing : new BalanceChannel();
                c.subscribers++;
                return c;
            });
            balanceSubscribers.incrementAndGet();
            try {
                // registered before the read: a change racing the snapshot is kept if it is newer
                channel.offer(balances.ensureInitialized(accountId));
            } catch (RuntimeException e) {
                releaseBalance(accountId, channel);
                return Flowable.error(e);
            }
            return channel.subject
                    .toFlowable(BackpressureStrategy.LATEST)
                    .map(AccountBalance::getAmount)
                    .doFinally(() -> releaseBalance(accountId, channel));
        });
    }

    /**
     * Existing records in arrival order, then every record appended afterwards.
     */
    public Flowable<TransactionRecord> subscribeTransactions(String accountId) {
        AccountIds.requireWellFormed(accountId);
        return Flowable.defer(() -> {
            RecordChannel channel = recordChannels.compute(accountId, (id, existing) -> {
                RecordChannel c = existing != null ? existing : new RecordChannel();
                c.subscribers++;
                return c;
            });
            recordSubscribers.incrementAndGet();

            // holds live records until the snapshot has been emitted
            UnicastProcessor<TransactionRecord> live = UnicastProcessor.create();
            Disposable liveSubscription = channel.subject.subscribe(live::onNext, live::onError, live::onComplete);

            List<TransactionRecord> snapshot;
            try {
                snapshot = transactionLog.list(accountId);
            } catch (RuntimeException e) {
                liveSubscription.dispose();
                releaseRecords(accountId, channel);
                return Flowable.error(e);
            }
            Set<UUID> snapshotIds = snapshot.stream()
                    .map(TransactionRecord::getId)
                    .collect(Collectors.toSet());

            return Flowable.fromIterable(snapshot)
                    .concatWith(live.filter(record -> !snapshotIds.contains(record.getId())))
                    .doFinally(() -> {
                        liveSubscription.dispose();
                        releaseRecords(accountId, channel);
                    });
        });
    }

    // a failing change must not cancel the store subscription
    private void deliver(LedgerChange change) {
        try {
            publish(change);
        } catch (RuntimeException e) {
            log.error("Failed to deliver committed change {}", change, e);
        }
    }

    /**
     * Delivers a committed change to the subscribers of its account, if any.
     */
    public void publish(LedgerChange change) {
        if (change instanceof LedgerChange.BalanceChanged balanceChanged) {
            BalanceChannel channel = balanceChannels.get(change.getAccountId());
            if (channel != null) {
                channel.offer(balanceChanged.getBalance());
            }
        } else if (change instanceof LedgerChange.RecordAppended appended) {
            RecordChannel channel = recordChannels.get(change.getAccountId());
            if (channel != null) {
                channel.subject.onNext(appended.getRecord());
            }
        }
    }

    int openChannels() {
        return balanceChannels.size() + recordChannels.size();
    }

    private void releaseBalance(String accountId, BalanceChannel channel) {
        balanceSubscribers.decrementAndGet();
        balanceChannels.computeIfPresent(accountId, (id, current) -> {
            if (current != channel) {
                return current;
            }
            return --current.subscribers == 0 ? null : current;
        });
    }

    private void releaseRecords(String accountId, RecordChannel channel) {
        recordSubscribers.decrementAndGet();
        recordChannels.computeIfPresent(accountId, (id, current) -> {
            if (current != channel) {
                return current;
            }
            return --current.subscribers == 0 ? null : current;
        });
    }

    private static final class BalanceChannel {
        private final Subject<AccountBalance> subject = BehaviorSubject.<AccountBalance>create().toSerialized();
        private AccountBalance latest;
        private int subscribers;

        synchronized void offer(AccountBalance balance) {
            if (latest != null && balance.getVersion() <= latest.getVersion()) {
                log.debug("Dropping stale balance of {}: version {} <= {}",
                        balance.getAccountId(), balance.getVersion(), latest.getVersion());
                return;
            }
            latest = balance;
            subject.onNext(balance);
        }
    }

    private static final class RecordChannel {
        private final Subject<TransactionRecord> subject = PublishSubject.<TransactionRecord>create().toSerialized();
        private int subscribers;
    }
}
