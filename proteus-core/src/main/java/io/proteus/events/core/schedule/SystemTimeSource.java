package io.proteus.events.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class SystemTimeSource
        implements TimeSource
{
    @Override
    public Instant now()
    {
        return Instant.now();
    }

    @Override
    public boolean sleepUntil(Instant deadline, CountDownLatch cancel)
        throws InterruptedException
    {
        while (true) {
            if (cancel.getCount() == 0) {
                return false;
            }
            long millis = Duration.between(Instant.now(), deadline).toMillis();
            if (millis <= 0) {
                return true;
            }
            // await may return early on clock adjustment; loop rechecks the deadline
            if (cancel.await(millis, TimeUnit.MILLISECONDS)) {
                return false;
            }
        }
    }
}
