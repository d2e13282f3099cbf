package com.panwatch.schedule;

import com.panwatch.exception.InvalidScheduleException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Five-field cron schedule: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Fields accept {@code *}, values, ranges, lists and steps. Day-of-week runs 0-7 where both
 * 0 and 7 are Sunday. When day-of-month and day-of-week are both restricted a day matches if
 * either does.
 *
 * <p>A minute field of exactly {@code *}{@code /N} is an interval: the minute matches when the
 * number of minutes since the epoch of the local wall time is a multiple of N. It is still
 * combined with the other fields.
 *
 * <p>All times are local wall-clock times in the scheduler zone; callers convert.
 * Instances are immutable and compare equal when they fire at exactly the same minutes.
 */
public final class CronSchedule {

    private static final int SEARCH_YEARS = 5;

    private final CronField minute;
    private final int minuteInterval;
    private final CronField hour;
    private final CronField dayOfMonth;
    private final CronField month;
    private final CronField dayOfWeek;

    private CronSchedule(
            CronField minute, int minuteInterval, CronField hour, CronField dayOfMonth, CronField month, CronField dayOfWeek) {
        this.minute = minute;
        this.minuteInterval = minuteInterval;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.month = month;
        this.dayOfWeek = dayOfWeek;
    }

    /**
     * Parses a five-field expression.
     *
     * @throws InvalidScheduleException on empty text, wrong field count, bad numbers, steps or ranges
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(expression, "expression is empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new InvalidScheduleException(expression, "expected 5 fields but found " + parts.length);
        }

        int interval = parseMinuteInterval(expression, parts[0]);
        CronField minute = interval > 0
                ? CronField.full("minute", 0, 59)
                : CronField.parse(expression, "minute", parts[0], 0, 59);
        CronField hour = CronField.parse(expression, "hour", parts[1], 0, 23);
        CronField dayOfMonth = CronField.parse(expression, "day-of-month", parts[2], 1, 31);
        CronField month = CronField.parse(expression, "month", parts[3], 1, 12);
        CronField dayOfWeek = CronField.parse(expression, "day-of-week", parts[4], 0, 7).fold(7, 0, 6);
        return new CronSchedule(minute, interval, hour, dayOfMonth, month, dayOfWeek);
    }

    /** Returns N for a minute field of the form "*&#47;N" with N greater than 1, otherwise 0. */
    private static int parseMinuteInterval(String expression, String field) {
        if (!field.startsWith("*/")) {
            return 0;
        }
        String step = field.substring(2);
        if (step.isEmpty() || !step.chars().allMatch(Character::isDigit) || step.length() > 9) {
            throw new InvalidScheduleException(expression, "bad minute step: " + field);
        }
        int n = Integer.parseInt(step);
        if (n <= 0 || n > 59) {
            throw new InvalidScheduleException(expression, "minute step out of range [1-59]: " + field);
        }
        // "*/1" is every minute
        return n == 1 ? 0 : n;
    }

    /** Same as {@link #parse} but returns empty instead of throwing. */
    public static Optional<CronSchedule> tryParse(String expression) {
        try {
            return Optional.of(parse(expression));
        } catch (InvalidScheduleException e) {
            return Optional.empty();
        }
    }

    /**
     * True when {@code now} (truncated to the minute) matches and no fire has been recorded
     * within that same minute.
     */
    public boolean isDue(LocalDateTime now, LocalDateTime lastFireTime) {
        LocalDateTime slot = now.truncatedTo(ChronoUnit.MINUTES);
        if (lastFireTime != null && !lastFireTime.truncatedTo(ChronoUnit.MINUTES).isBefore(slot)) {
            return false;
        }
        return matches(slot);
    }

    /** True when the minute containing {@code time} matches every field. */
    public boolean matches(LocalDateTime time) {
        return matchesDay(time.toLocalDate()) && hour.matches(time.getHour()) && matchesMinute(time);
    }

    /**
     * First matching minute strictly after {@code now}, or empty when nothing matches within
     * five years (e.g. February 31st).
     */
    public Optional<LocalDateTime> nextFireAfter(LocalDateTime now) {
        LocalDateTime start = now.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDate limit = start.toLocalDate().plusYears(SEARCH_YEARS);

        LocalDate day = start.toLocalDate();
        boolean firstDay = true;
        while (!day.isAfter(limit)) {
            if (matchesDay(day)) {
                int fromHour = firstDay ? start.getHour() : 0;
                for (int h = hour.nextSetAtOrAfter(fromHour); h >= 0 && h <= 23; h = hour.nextSetAtOrAfter(h + 1)) {
                    int fromMinute = firstDay && h == start.getHour() ? start.getMinute() : 0;
                    for (int m = fromMinute; m <= 59; m++) {
                        LocalDateTime candidate = day.atTime(h, m);
                        if (matchesMinute(candidate)) {
                            return Optional.of(candidate);
                        }
                    }
                }
            }
            day = day.plusDays(1);
            firstDay = false;
        }
        return Optional.empty();
    }

    /** Normalised expression; {@code parse(toExpression())} equals this schedule. */
    public String toExpression() {
        String minuteText = minuteInterval > 0 ? "*/" + minuteInterval : minute.toExpression();
        return String.join(
                " ",
                minuteText,
                hour.toExpression(),
                dayOfMonth.toExpression(),
                month.toExpression(),
                dayOfWeek.toExpression());
    }

    public boolean isMinuteInterval() {
        return minuteInterval > 0;
    }

    private boolean matchesMinute(LocalDateTime time) {
        if (minuteInterval > 0) {
            long minutesSinceEpoch = time.toEpochSecond(ZoneOffset.UTC) / 60;
            return Math.floorMod(minutesSinceEpoch, minuteInterval) == 0;
        }
        return minute.matches(time.getMinute());
    }

    private boolean matchesDay(LocalDate date) {
        if (!month.matches(date.getMonthValue())) {
            return false;
        }
        boolean domMatch = dayOfMonth.matches(date.getDayOfMonth());
        // java DayOfWeek: MONDAY=1..SUNDAY=7, cron: SUNDAY=0
        boolean dowMatch = dayOfWeek.matches(date.getDayOfWeek().getValue() % 7);
        if (dayOfMonth.isRestricted() && dayOfWeek.isRestricted()) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronSchedule other)) {
            return false;
        }
        return minuteInterval == other.minuteInterval
                && minute.equals(other.minute)
                && hour.equals(other.hour)
                && dayOfMonth.equals(other.dayOfMonth)
                && month.equals(other.month)
                && dayOfWeek.equals(other.dayOfWeek);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute, minuteInterval, hour, dayOfMonth, month, dayOfWeek);
    }

    @Override
    public String toString() {
        return toExpression();
    }
}
