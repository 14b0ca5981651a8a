package com.example.cronscheduler.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.example.cronscheduler.exception.InvalidScheduleException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Standard five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 * <p>
 * Parsing and the per-field search are done by cron-utils with the UNIX definition
 * (month and day names, day-of-week 7 as Sunday). On top of it this class applies the
 * Vixie day rule: day-of-month and day-of-week are OR-combined when both are restricted
 * and AND-combined when either one starts with {@code *}. To keep that rule independent
 * of the library, the expression is split into a day-of-month half (day-of-week set to
 * {@code *}) and a day-of-week half (day-of-month set to {@code *}).
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class CronExpression {

    /**
     * Upper bound for the forward search; covers the full leap-year and weekday cycle
     */
    private static final int SEARCH_LIMIT_YEARS = 28;

    private static final int LEAP_YEAR = 2024;

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final String expression;
    private final ExecutionTime dayOfMonthHalf;
    private final ExecutionTime dayOfWeekHalf;
    private final boolean dayOfMonthWildcard;
    private final boolean dayOfWeekWildcard;
    private final boolean dayOfMonthSatisfiable;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        parseCron(expression);
        this.dayOfMonthHalf = ExecutionTime.forCron(
                parseCron(join(fields[0], fields[1], fields[2], fields[3], "*")));
        this.dayOfWeekHalf = ExecutionTime.forCron(
                parseCron(join(fields[0], fields[1], "*", fields[3], fields[4])));
        this.dayOfMonthWildcard = fields[2].startsWith("*");
        this.dayOfWeekWildcard = fields[4].startsWith("*");
        this.dayOfMonthSatisfiable = anyCalendarDayMatches(
                ExecutionTime.forCron(parseCron(join("0", "0", fields[2], fields[3], "*"))));
    }

    /**
     * Parse a five-field cron expression.
     *
     * @throws InvalidScheduleException if the expression is malformed
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(expression), "cron expression is empty");
        }
        var normalized = expression.trim().replaceAll("\\s+", " ");
        var fields = normalized.split(" ");
        if (fields.length != 5) {
            throw new InvalidScheduleException(expression,
                    "expected 5 fields (minute hour day-of-month month day-of-week), found " + fields.length);
        }
        return new CronExpression(normalized, fields);
    }

    /**
     * Check whether an expression parses, without throwing
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    /**
     * Smallest time strictly after {@code after} that satisfies every field,
     * evaluated in the zone of {@code after}.
     * <p>
     * Local times that fall into a DST gap are skipped; local times repeated by a DST
     * overlap fire once, at the earlier offset.
     *
     * @return the next matching time, or empty if none exists within the search horizon
     */
    public Optional<ZonedDateTime> next(ZonedDateTime after) {
        Objects.requireNonNull(after, "after");
        var limit = after.plusYears(SEARCH_LIMIT_YEARS);

        if (!dayOfMonthWildcard && !dayOfWeekWildcard) {
            var byDayOfMonth = dayOfMonthSatisfiable ? nextOf(dayOfMonthHalf, after, limit) : Optional.<ZonedDateTime>empty();
            var byDayOfWeek = nextOf(dayOfWeekHalf, after, limit);
            if (byDayOfMonth.isEmpty()) {
                return byDayOfWeek;
            }
            if (byDayOfWeek.isEmpty()) {
                return byDayOfMonth;
            }
            return byDayOfMonth.get().isAfter(byDayOfWeek.get()) ? byDayOfWeek : byDayOfMonth;
        }

        if (!dayOfMonthSatisfiable) {
            return Optional.empty();
        }
        if (expressionField(2).equals("*")) {
            return nextOf(dayOfWeekHalf, after, limit);
        }
        return nextOnMatchingWeekday(after, limit);
    }

    /**
     * Whether the given wall-clock minute satisfies every field
     */
    public boolean matches(LocalDateTime time) {
        var at = time.atZone(ZoneOffset.UTC);
        var byDayOfMonth = dayOfMonthHalf.isMatch(at);
        var byDayOfWeek = dayOfWeekHalf.isMatch(at);
        if (dayOfMonthWildcard || dayOfWeekWildcard) {
            return byDayOfMonth && byDayOfWeek;
        }
        return byDayOfMonth || byDayOfWeek;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * AND case with a restricted day-of-month: walk the day-of-month half and keep the
     * first candidate whose weekday also matches, skipping the rest of a rejected day.
     */
    private Optional<ZonedDateTime> nextOnMatchingWeekday(ZonedDateTime after, ZonedDateTime limit) {
        var cursor = after;
        while (true) {
            var candidate = nextOf(dayOfMonthHalf, cursor, limit);
            if (candidate.isEmpty() || dayOfWeekHalf.isMatch(candidate.get())) {
                return candidate;
            }
            var endOfDay = candidate.get().toLocalDate().atTime(LocalTime.of(23, 59));
            cursor = ZonedDateTime.ofLocal(endOfDay, after.getZone(), candidate.get().getOffset());
            if (!cursor.isAfter(candidate.get())) {
                cursor = candidate.get();
            }
        }
    }

    /**
     * Next execution of one half, keeping only candidates whose wall-clock time really
     * matches (not shifted out of a DST gap) and lies after the wall-clock time of {@code after}
     * (so a repeated local time does not fire twice).
     */
    private static Optional<ZonedDateTime> nextOf(ExecutionTime executionTime, ZonedDateTime after, ZonedDateTime limit) {
        var floor = after.toLocalDateTime();
        var cursor = after;
        while (true) {
            var candidate = executionTime.nextExecution(cursor);
            if (candidate.isEmpty() || candidate.get().isAfter(limit)) {
                return Optional.empty();
            }
            var found = candidate.get();
            if (found.isAfter(after) && found.toLocalDateTime().isAfter(floor) && executionTime.isMatch(found)) {
                return candidate;
            }
            cursor = found.isAfter(cursor) ? found : cursor.plusMinutes(1);
        }
    }

    private static boolean anyCalendarDayMatches(ExecutionTime dayCron) {
        for (var date = LocalDate.of(LEAP_YEAR, 1, 1); date.getYear() == LEAP_YEAR; date = date.plusDays(1)) {
            if (dayCron.isMatch(date.atStartOfDay(ZoneOffset.UTC))) {
                return true;
            }
        }
        return false;
    }

    private String expressionField(int index) {
        return expression.split(" ")[index];
    }

    private Cron parseCron(String text) {
        try {
            var cron = PARSER.parse(text.toUpperCase(Locale.ROOT));
            return cron.validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, e.getMessage());
        }
    }

    private static String join(String... fields) {
        return String.join(" ", fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronExpression other)) {
            return false;
        }
        return expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
