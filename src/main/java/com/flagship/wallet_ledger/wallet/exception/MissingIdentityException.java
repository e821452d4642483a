package com.flagship.wallet_ledger.wallet.exception;

/**
 * The request did not identify the calling account.
 */
public class MissingIdentityException extends RuntimeException {

    public MissingIdentityException(String message) {
        super(message);
    }
}
