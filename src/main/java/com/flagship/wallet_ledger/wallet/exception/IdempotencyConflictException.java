package com.flagship.wallet_ledger.wallet.exception;

import lombok.Getter;

/**
 * An Idempotency-Key is still being processed, or was used for a different request.
 */
@Getter
public class IdempotencyConflictException extends RuntimeException {

    private final String idempotencyKey;

    public IdempotencyConflictException(String idempotencyKey, String message) {
        super(message);
        this.idempotencyKey = idempotencyKey;
    }
}
