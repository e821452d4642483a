package com.flagship.wallet_ledger.ledger;

/**
 * Type of a transaction log record.
 */
public enum TransactionKind {
    DEPOSIT(true),
    TRANSFER_SENT(false),
    TRANSFER_RECEIVED(true);

    private final boolean credit;

    TransactionKind(boolean credit) {
        this.credit = credit;
    }

    /**
     * True when the record added funds to the account.
     */
    public boolean isCredit() {
        return credit;
    }
}
