package com.flagship.wallet_ledger.store;

import com.flagship.wallet_ledger.ledger.AccountBalance;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import lombok.Value;

/**
 * A committed change to one account, as delivered by {@link LedgerStore#changes()}.
 */
public interface LedgerChange {

    String getAccountId();

    /**
     * The balance row of an account was created or mutated.
     */
    @Value
    class BalanceChanged implements LedgerChange {
        AccountBalance balance;

        @Override
        public String getAccountId() {
            return balance.getAccountId();
        }
    }

    /**
     * A record was appended to an account's transaction log.
     */
    @Value
    class RecordAppended implements LedgerChange {
        TransactionRecord record;

        @Override
        public String getAccountId() {
            return record.getAccountId();
        }
    }
}
