package com.flagship.wallet_ledger.store;

import java.time.Duration;

/**
 * Point in time after which a not-yet-submitted store operation is abandoned.
 *
 * Only checked before an attempt is submitted: an attempt already sent for
 * commit always runs to completion.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);
    private static final Duration LONGEST = Duration.ofDays(1);

    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration timeout) {
        if (timeout == null) {
            return NONE;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative: " + timeout);
        }
        if (timeout.compareTo(LONGEST) > 0) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return this != NONE && System.nanoTime() - expiresAtNanos >= 0;
    }

    public Duration remaining() {
        if (this == NONE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.max(0, expiresAtNanos - System.nanoTime()));
    }

    @Override
    public String toString() {
        return this == NONE ? "Deadline[none]" : "Deadline[remaining=" + remaining() + "]";
    }
}
