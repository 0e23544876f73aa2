package io.taskrelay.runtime;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class IdleBackoffTest {

    @Test
    void idleCyclesDoubleUpToCeilingAndWorkResets() {
        IdleBackoff backoff = new IdleBackoff(5_000L, 30_000L);
        Assertions.assertEquals(5_000L, backoff.next(true));
        Assertions.assertEquals(10_000L, backoff.next(true));
        Assertions.assertEquals(20_000L, backoff.next(true));
        Assertions.assertEquals(30_000L, backoff.next(true));
        Assertions.assertEquals(30_000L, backoff.next(true));
        Assertions.assertEquals(5_000L, backoff.next(false));
        Assertions.assertEquals(5_000L, backoff.current());
    }

    @Test
    void ceilingNeverBelowBase() {
        IdleBackoff backoff = new IdleBackoff(5_000L, 1_000L);
        Assertions.assertEquals(5_000L, backoff.next(true));
        Assertions.assertEquals(5_000L, backoff.next(true));
    }
}
