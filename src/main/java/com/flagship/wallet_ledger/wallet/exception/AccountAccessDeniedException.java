package com.flagship.wallet_ledger.wallet.exception;

/**
 * The caller asked for another account's balance or history.
 */
public class AccountAccessDeniedException extends RuntimeException {

    public AccountAccessDeniedException(String callerId, String accountId) {
        super(String.format("Account %s cannot read account %s", callerId, accountId));
    }
}
