package io.proteus.events.core.schedule;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval strings. Accepts ISO-8601 durations ({@code PT1H}, {@code P1D})
 * and the short form {@code 1d 2h 3m 4s} where any unit may be omitted.
 */
public class Durations
{
    private static final Pattern SHORT_PATTERN =
            Pattern.compile("\\s*(?:(?<days>\\d+)\\s*d)?\\s*(?:(?<hours>\\d+)\\s*h)?\\s*(?:(?<minutes>\\d+)\\s*m)?\\s*(?:(?<seconds>\\d+)\\s*s)?\\s*",
                    Pattern.CASE_INSENSITIVE);

    private Durations()
    { }

    public static Duration parseDuration(CharSequence text)
    {
        String s = text.toString().trim();
        if (s.startsWith("P") || s.startsWith("p") || s.startsWith("-P")) {
            return Duration.parse(s);
        }
        return parseShortDuration(s);
    }

    private static Duration parseShortDuration(CharSequence text)
    {
        Matcher matcher = SHORT_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new DateTimeParseException("Invalid duration", text, 0);
        }
        String d = matcher.group("days");
        String h = matcher.group("hours");
        String m = matcher.group("minutes");
        String s = matcher.group("seconds");
        if (d == null && h == null && m == null && s == null) {
            throw new DateTimeParseException("Invalid duration", text, 0);
        }
        try {
            return Duration
                    .ofDays(d == null ? 0 : Long.parseLong(d))
                    .plusHours(h == null ? 0 : Long.parseLong(h))
                    .plusMinutes(m == null ? 0 : Long.parseLong(m))
                    .plusSeconds(s == null ? 0 : Long.parseLong(s));
        }
        catch (NumberFormatException | ArithmeticException ex) {
            throw new DateTimeParseException("Duration out of range", text, 0, ex);
        }
    }
}
