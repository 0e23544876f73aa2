package io.taskrelay.runtime;

/**
 * Delay between run-loop cycles: the base interval while there is work, doubling
 * up to a ceiling while cycles come back idle.
 */
public final class IdleBackoff {
    private final long baseMs;
    private final long maxMs;
    private long currentMs;

    public IdleBackoff(long baseMs, long maxMs) {
        this.baseMs = Math.max(1L, baseMs);
        this.maxMs = Math.max(this.baseMs, maxMs);
        this.currentMs = this.baseMs;
    }

    public long next(boolean idle) {
        if (!idle) {
            currentMs = baseMs;
            return currentMs;
        }
        long delay = currentMs;
        currentMs = Math.min(maxMs, currentMs * 2L);
        return delay;
    }

    public long current() {
        return currentMs;
    }
}
