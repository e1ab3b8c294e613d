package com.dcarunner.scheduling;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses schedule frequencies: "15 minutes", "1 hour", "12 hours", "1 day", "every 1 minute", or ISO-8601 ("PT15M").
 */
public final class ScheduleIntervals {

    private static final Pattern HUMAN = Pattern.compile(
            "^(?:every\\s+)?(\\d+)\\s*(second|minute|hour|day|week)s?$");

    private ScheduleIntervals() {
    }

    /**
     * @throws IllegalArgumentException when the text is not a recognised positive interval
     */
    public static Duration parse(String frequency) {
        if (frequency == null || frequency.isBlank()) {
            throw new IllegalArgumentException("Frequency is required");
        }
        String text = frequency.trim().toLowerCase(Locale.ROOT);
        Matcher m = HUMAN.matcher(text);
        Duration duration;
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            duration = switch (m.group(2)) {
                case "second" -> Duration.ofSeconds(n);
                case "minute" -> Duration.ofMinutes(n);
                case "hour" -> Duration.ofHours(n);
                case "day" -> Duration.ofDays(n);
                default -> Duration.ofDays(7 * n);
            };
        } else {
            try {
                duration = Duration.parse(frequency.trim().toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unrecognised frequency: " + frequency, e);
            }
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Frequency must be positive: " + frequency);
        }
        return duration;
    }
}
