package io.proteus.events.core.schedule;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import org.immutables.value.Value;

/**
 * A parsed schedule: a start instant, optionally followed by an interval and a repeat count.
 *
 * <pre>
 *   start[/interval[/count]]
 *   R[count]/start/interval
 * </pre>
 *
 * The start is {@code now}, an ISO-8601 instant or an ISO-8601 offset date-time.
 * The interval is an ISO-8601 duration or the short {@code 1d 2h 3m 4s} form.
 * An omitted count means the schedule repeats forever. A schedule without an interval
 * fires exactly once.
 */
@Value.Immutable
public abstract class ScheduleSpec
{
    private static final Pattern REPEAT_PREFIX = Pattern.compile("R(\\d*)");

    public abstract Instant getStartTime();

    /**
     * Zero if the schedule does not repeat.
     */
    public abstract Duration getInterval();

    /**
     * Absent means unbounded.
     */
    public abstract Optional<Integer> getRepeatCount();

    @Value.Check
    protected void check()
    {
        if (getInterval().isNegative()) {
            throw new IllegalStateException("interval must not be negative: " + getInterval());
        }
        if (getRepeatCount().isPresent() && getRepeatCount().get() < 0) {
            throw new IllegalStateException("repeat count must not be negative: " + getRepeatCount().get());
        }
        if (getInterval().isZero() && !getRepeatCount().equals(Optional.of(0))) {
            throw new IllegalStateException("a schedule without interval must have repeat count 0");
        }
    }

    public boolean isUnbounded()
    {
        return !getRepeatCount().isPresent();
    }

    /**
     * Computes the fire time that follows {@code firingsSoFar} completed firings.
     *
     * The first fire time is the start time regardless of {@code previous}. Later fire
     * times are {@code previous + interval}, so passing the previous scheduled time
     * (rather than the time the firing actually happened) keeps the schedule from drifting.
     *
     * @param previous the previous scheduled fire time; ignored when firingsSoFar is 0
     * @param firingsSoFar number of completed firings
     */
    public FireTime nextFireTime(Instant previous, int firingsSoFar)
    {
        if (firingsSoFar < 0) {
            throw new IllegalArgumentException("firingsSoFar must not be negative: " + firingsSoFar);
        }
        if (firingsSoFar == 0) {
            return FireTime.of(getStartTime(), !getRepeatCount().equals(Optional.of(0)));
        }
        boolean hasMore = isUnbounded() || firingsSoFar < getRepeatCount().get();
        return FireTime.of(previous.plus(getInterval()), hasMore);
    }

    public static ScheduleSpec of(Instant startTime, Duration interval, Optional<Integer> repeatCount)
    {
        return ImmutableScheduleSpec.builder()
            .startTime(startTime)
            .interval(interval)
            .repeatCount(repeatCount)
            .build();
    }

    public static ScheduleSpec once(Instant startTime)
    {
        return of(startTime, Duration.ZERO, Optional.of(0));
    }

    /**
     * Parses a schedule string.
     *
     * @param text the schedule string
     * @param now the instant {@code now} resolves to
     */
    public static ScheduleSpec parse(String text, Instant now)
            throws MalformedScheduleException
    {
        if (text == null || text.trim().isEmpty()) {
            throw new MalformedScheduleException("Schedule must not be empty");
        }
        List<String> segments = Splitter.on('/').trimResults().splitToList(text.trim());
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new MalformedScheduleException("Schedule has an empty segment: " + text);
            }
        }

        Matcher repeat = REPEAT_PREFIX.matcher(segments.get(0));
        if (repeat.matches()) {
            return parseRepeatingInterval(text, segments, repeat.group(1), now);
        }

        if (segments.size() > 3) {
            throw new MalformedScheduleException("Schedule must be start[/interval[/count]]: " + text);
        }

        Instant start = parseStart(segments.get(0), now);
        if (segments.size() == 1) {
            return once(start);
        }

        Duration interval = parseInterval(segments.get(1));
        Optional<Integer> count;
        if (segments.size() == 3) {
            count = Optional.of(parseCount(segments.get(2)));
        }
        else {
            count = Optional.absent();
        }
        return of(start, interval, count);
    }

    // R5/2016-10-20T10:30:00Z/PT1H
    private static ScheduleSpec parseRepeatingInterval(String text, List<String> segments, String count, Instant now)
            throws MalformedScheduleException
    {
        if (segments.size() != 3) {
            throw new MalformedScheduleException("Repeating schedule must be R[count]/start/interval: " + text);
        }
        Instant start = parseStart(segments.get(1), now);
        Duration interval = parseInterval(segments.get(2));
        if (count.isEmpty()) {
            return of(start, interval, Optional.absent());
        }
        return of(start, interval, Optional.of(parseCount(count)));
    }

    private static Instant parseStart(String text, Instant now)
            throws MalformedScheduleException
    {
        if (text.equalsIgnoreCase("now")) {
            return now;
        }
        try {
            return Instant.parse(text);
        }
        catch (DateTimeParseException ex) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            }
            catch (DateTimeParseException ex2) {
                throw new MalformedScheduleException("Invalid start time: " + text, ex2);
            }
        }
    }

    private static Duration parseInterval(String text)
            throws MalformedScheduleException
    {
        Duration interval;
        try {
            interval = Durations.parseDuration(text);
        }
        catch (DateTimeException | ArithmeticException ex) {
            throw new MalformedScheduleException("Invalid interval: " + text, ex);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new MalformedScheduleException("Interval must be positive: " + text);
        }
        return interval;
    }

    private static int parseCount(String text)
            throws MalformedScheduleException
    {
        if (!text.chars().allMatch(Character::isDigit)) {
            throw new MalformedScheduleException("Repeat count must be a non-negative integer: " + text);
        }
        try {
            return Integer.parseInt(text);
        }
        catch (NumberFormatException ex) {
            throw new MalformedScheduleException("Repeat count is too large: " + text, ex);
        }
    }
}
