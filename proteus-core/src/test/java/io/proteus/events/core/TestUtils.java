package io.proteus.events.core;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.TemporalAmount;
import java.util.concurrent.Callable;

import static org.junit.Assert.fail;

public class TestUtils
{
    private TestUtils()
    { }

    public static void expect(TemporalAmount timeout, Callable<Boolean> condition)
            throws Exception
    {
        expect(timeout, condition, Duration.ofMillis(20));
    }

    public static void expect(TemporalAmount timeout, Callable<Boolean> condition, Duration interval)
            throws Exception
    {
        Instant deadline = Instant.now().plus(timeout);
        while (Instant.now().toEpochMilli() < deadline.toEpochMilli()) {
            if (condition.call()) {
                return;
            }
            Thread.sleep(interval.toMillis());
        }

        fail("Timeout after: " + timeout);
    }
}
