package org.dxworks.codeshaper;

/**
 * Wall-clock budget for one engine call. Tree walks call {@link #check()} as they go.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, 0);

    private final long expiresAtNanos;
    private final long budgetMillis;

    private Deadline(long expiresAtNanos, long budgetMillis) {
        this.expiresAtNanos = expiresAtNanos;
        this.budgetMillis = budgetMillis;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline afterMillis(long millis) {
        if (millis <= 0) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + millis * 1_000_000L, millis);
    }

    public void check() {
        if (this != NONE && System.nanoTime() - expiresAtNanos > 0) {
            throw new LimitExceededException("Operation exceeded the time limit of " + budgetMillis + " ms");
        }
    }
}
