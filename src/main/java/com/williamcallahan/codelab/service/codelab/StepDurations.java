package com.williamcallahan.codelab.service.codelab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Parses and rounds step durations.
 */
public final class StepDurations {

    private static final Logger logger = LoggerFactory.getLogger(StepDurations.class);

    // hour:minute:second, right-aligned to the components present
    private static final List<ChronoUnit> FACTORS = List.of(ChronoUnit.HOURS, ChronoUnit.MINUTES, ChronoUnit.SECONDS);

    static final Duration MAX_DURATION = Duration.ofSeconds(Long.MAX_VALUE);
    private static final long MAX_WHOLE_MINUTES = MAX_DURATION.toMinutes();

    private StepDurations() {
    }

    /**
     * Parses a {@code H:MM:SS} value. The rightmost component is seconds, then minutes, then
     * hours; a single bare component is minutes. Components that are not integers, or that do
     * not fit in a {@link Duration}, count as zero.
     *
     * @param value duration text
     * @return parsed duration, never negative
     */
    public static Duration parse(String value) {
        if (value == null) {
            return Duration.ZERO;
        }
        String[] parts = value.trim().split(":", FACTORS.size());
        if (parts.length == 1) {
            parts = new String[] {parts[0], "0"};
        }
        Duration total = Duration.ZERO;
        int offset = FACTORS.size() - parts.length;
        for (int index = 0; index < parts.length; index++) {
            long amount;
            try {
                amount = Long.parseLong(parts[index].trim());
            } catch (NumberFormatException notNumeric) {
                continue;
            }
            if (amount > 0) {
                total = saturatedSum(total, component(amount, FACTORS.get(offset + index)));
            }
        }
        return total;
    }

    private static Duration component(long amount, ChronoUnit unit) {
        try {
            return Duration.of(amount, unit);
        } catch (ArithmeticException outOfRange) {
            logger.debug("Ignoring out-of-range duration component {} {}", amount, unit);
            return Duration.ZERO;
        }
    }

    /**
     * Rounds up to the next whole minute: 44s and 60s become 1m, 61s becomes 2m.
     *
     * @param duration duration to round
     * @return smallest whole-minute duration not below {@code duration}
     */
    public static Duration roundUp(Duration duration) {
        Duration rounded = Duration.ofMinutes(duration.toMinutes());
        if (rounded.compareTo(duration) < 0 && duration.toMinutes() < MAX_WHOLE_MINUTES) {
            rounded = rounded.plusMinutes(1);
        }
        return rounded;
    }

    /**
     * Adds two durations, saturating at the largest representable duration.
     *
     * @param left first addend
     * @param right second addend
     * @return sum, or {@link #MAX_DURATION} on overflow
     */
    public static Duration saturatedSum(Duration left, Duration right) {
        try {
            return left.plus(right);
        } catch (ArithmeticException overflow) {
            return MAX_DURATION;
        }
    }

    /**
     * Converts to whole minutes, clamped to the {@code int} range used by the document model.
     *
     * @param duration duration, never negative
     * @return minutes between 0 and {@link Integer#MAX_VALUE}
     */
    public static int wholeMinutes(Duration duration) {
        long minutes = duration.toMinutes();
        if (minutes <= 0) {
            return 0;
        }
        return (int) Math.min(minutes, Integer.MAX_VALUE);
    }
}
