package io.proteus.events.core.schedule;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;

/**
 * Source of the current instant and of timed waits.
 */
public interface TimeSource
{
    Instant now();

    /**
     * Blocks until {@code deadline} or until {@code cancel} reaches zero.
     *
     * @return true if the deadline was reached, false if cancelled first
     */
    boolean sleepUntil(Instant deadline, CountDownLatch cancel)
        throws InterruptedException;
}
