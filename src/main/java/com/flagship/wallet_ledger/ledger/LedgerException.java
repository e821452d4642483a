package com.flagship.wallet_ledger.ledger;

import lombok.Getter;

/**
 * Raised when a ledger operation fails for one of the {@link ErrorKind} reasons.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    public LedgerException(ErrorKind kind) {
        super(kind.getUserMessage());
        this.kind = kind;
    }

    public LedgerException(ErrorKind kind, String detail) {
        super(detail);
        this.kind = kind;
    }

    public LedgerException(ErrorKind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
