package com.flagship.wallet_ledger.outbox;

import com.flagship.wallet_ledger.config.LedgerInstance;
import com.flagship.wallet_ledger.ledger.event.BalanceChangedEvent;
import com.flagship.wallet_ledger.ledger.event.LedgerEvent;
import com.flagship.wallet_ledger.ledger.event.TransactionAppendedEvent;
import com.flagship.wallet_ledger.store.LedgerChange;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns the changes of a store transaction into outbox events.
 *
 * Must be called inside the transaction that made the changes.
 */
@Component
@RequiredArgsConstructor
public class LedgerChangeJournal {

    private final OutboxService outboxService;
    private final LedgerInstance instance;

    public void record(List<LedgerChange> changes) {
        for (LedgerChange change : changes) {
            outboxService.record(toEvent(change));
        }
    }

    LedgerEvent toEvent(LedgerChange change) {
        if (change instanceof LedgerChange.BalanceChanged balanceChanged) {
            return BalanceChangedEvent.from(balanceChanged.getBalance(), instance.getId());
        }
        if (change instanceof LedgerChange.RecordAppended appended) {
            return TransactionAppendedEvent.from(appended.getRecord(), instance.getId());
        }
        throw new IllegalArgumentException("Unknown ledger change: " + change.getClass().getSimpleName());
    }
}
