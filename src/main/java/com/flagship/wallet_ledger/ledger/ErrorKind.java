package com.flagship.wallet_ledger.ledger;

/**
 * Failure kinds of ledger operations.
 *
 * Each kind carries the short message shown to the user and whether the
 * caller may safely repeat the whole operation.
 */
public enum ErrorKind {
    INVALID_AMOUNT("Invalid amount. Enter a positive value with at most two decimal places.", false),
    SELF_TRANSFER_NOT_ALLOWED("You cannot transfer funds to your own account.", false),
    INVALID_RECIPIENT("The recipient account id is not valid.", false),
    INSUFFICIENT_FUNDS("Insufficient balance for this transfer.", false),
    TRANSIENT_STORE_ERROR("The ledger is temporarily unavailable. Please try again.", true),
    LOG_WRITE_FAILED("Funds were moved, but the transaction history could not be updated yet.", false),
    TIMEOUT("The operation timed out before it was submitted. No funds were moved.", true);

    private final String userMessage;
    private final boolean retryable;

    ErrorKind(String userMessage, boolean retryable) {
        this.userMessage = userMessage;
        this.retryable = retryable;
    }

    public String getUserMessage() {
        return userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
