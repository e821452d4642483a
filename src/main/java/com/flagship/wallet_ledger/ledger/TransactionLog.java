package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Append-only per-account transaction history.
 *
 * Records are never updated or deleted; the table rejects both.
 */
@Service
@RequiredArgsConstructor
public class TransactionLog {

    private final LedgerStore store;

    /**
     * Stores a draft record. The store assigns the id and the timestamp.
     */
    public TransactionRecord append(TransactionRecord draft) {
        if (draft.getId() != null) {
            throw new IllegalArgumentException("Record " + draft.getId() + " was already appended");
        }
        return store.append(draft);
    }

    /**
     * Records of the account in the order they were appended.
     * Use {@link TransactionRecord#NEWEST_FIRST} for display order.
     */
    public List<TransactionRecord> list(String accountId) {
        return store.listRecords(accountId);
    }
}
