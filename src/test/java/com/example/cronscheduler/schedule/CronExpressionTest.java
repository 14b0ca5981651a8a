package com.example.cronscheduler.schedule;

import com.example.cronscheduler.exception.InvalidScheduleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CronExpression Tests")
class CronExpressionTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static ZonedDateTime utc(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    private static ZonedDateTime nextOf(String expression, ZonedDateTime after) {
        return CronExpression.parse(expression).next(after).orElseThrow();
    }

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("Should normalize whitespace")
        void shouldNormalizeWhitespace() {
            var cron = CronExpression.parse("  */5   *  * * *  ");

            assertThat(cron.getExpression()).isEqualTo("*/5 * * * *");
            assertThat(cron).isEqualTo(CronExpression.parse("*/5 * * * *"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "* * * *",
                "* * * * * *",
                "60 * * * *",
                "* 24 * * *",
                "* * 0 * *",
                "* * * 13 *",
                "* * * * 8",
                "a * * * *",
                "* * * FOO *"
        })
        @DisplayName("Should reject malformed expressions")
        void shouldRejectMalformedExpressions(String expression) {
            assertThatThrownBy(() -> CronExpression.parse(expression))
                    .isInstanceOf(InvalidScheduleException.class);
            assertThat(CronExpression.isValid(expression)).isFalse();
        }

        @Test
        @DisplayName("Should report the rejected expression in the error")
        void shouldReportRejectedExpression() {
            assertThatThrownBy(() -> CronExpression.parse("0  25 * * *"))
                    .hasMessageContaining("'0 25 * * *'")
                    .isInstanceOfSatisfying(InvalidScheduleException.class,
                            e -> assertThat(e.getSchedule()).isEqualTo("0 25 * * *"));
        }

        @Test
        @DisplayName("Should report the field count")
        void shouldReportFieldCount() {
            assertThatThrownBy(() -> CronExpression.parse("0 0 * * * *"))
                    .isInstanceOf(InvalidScheduleException.class)
                    .hasMessageContaining("found 6");
        }

        @Test
        @DisplayName("Should reject null")
        void shouldRejectNull() {
            assertThatThrownBy(() -> CronExpression.parse(null))
                    .isInstanceOf(InvalidScheduleException.class)
                    .hasMessageContaining("empty");
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "* * * * *",
                "0 0 1 1 *",
                "0,15,30,45 9-17 * * MON-FRI",
                "5/10 * * * *",
                "0 12 * jan,jul sun",
                "0 0 * * 7"
        })
        @DisplayName("Should accept valid expressions")
        void shouldAcceptValidExpressions(String expression) {
            assertThat(CronExpression.isValid(expression)).isTrue();
        }
    }

    @Nested
    @DisplayName("Next occurrence")
    class NextOccurrenceTests {

        @Test
        @DisplayName("Every five minutes from 12:00 should fire at 12:05")
        void everyFiveMinutesFromNoon() {
            assertThat(nextOf("*/5 * * * *", utc(2024, 1, 1, 12, 0)))
                    .isEqualTo(utc(2024, 1, 1, 12, 5));
        }

        @Test
        @DisplayName("Result should be strictly after the given time, even mid-minute")
        void resultShouldBeStrictlyAfter() {
            var after = utc(2024, 1, 1, 12, 4).plusSeconds(30);

            assertThat(nextOf("*/5 * * * *", after)).isEqualTo(utc(2024, 1, 1, 12, 5));
            assertThat(nextOf("* * * * *", utc(2024, 1, 1, 12, 5))).isEqualTo(utc(2024, 1, 1, 12, 6));
        }

        @Test
        @DisplayName("Should roll over hour, day, month and year")
        void shouldRollOver() {
            assertThat(nextOf("0 0 1 1 *", utc(2024, 6, 15, 8, 30))).isEqualTo(utc(2025, 1, 1, 0, 0));
        }

        @Test
        @DisplayName("Should skip months without the requested day")
        void shouldSkipShortMonths() {
            assertThat(nextOf("0 0 31 * *", utc(2024, 1, 31, 0, 0))).isEqualTo(utc(2024, 3, 31, 0, 0));
        }

        @Test
        @DisplayName("February 29th should only fire in leap years")
        void leapDayShouldFireInLeapYears() {
            assertThat(nextOf("0 0 29 2 *", utc(2024, 3, 1, 0, 0))).isEqualTo(utc(2028, 2, 29, 0, 0));
        }

        @Test
        @DisplayName("Step from a start value should run to the end of the field")
        void stepFromStartValue() {
            assertThat(nextOf("5/20 * * * *", utc(2024, 1, 1, 10, 30))).isEqualTo(utc(2024, 1, 1, 10, 45));
            assertThat(nextOf("5/20 * * * *", utc(2024, 1, 1, 10, 45))).isEqualTo(utc(2024, 1, 1, 11, 5));
        }

        @Test
        @DisplayName("Should accept month and day names")
        void shouldAcceptNames() {
            // 2024-06-01 is a Saturday
            assertThat(nextOf("0 9 * JUL mon", utc(2024, 6, 1, 0, 0))).isEqualTo(utc(2024, 7, 1, 9, 0));
        }

        @Test
        @DisplayName("Day-of-week 7 should mean Sunday")
        void sevenShouldMeanSunday() {
            // 2024-09-02 is a Monday
            var fromSeven = nextOf("0 9 * * 7", utc(2024, 9, 2, 0, 0));
            var fromZero = nextOf("0 9 * * 0", utc(2024, 9, 2, 0, 0));

            assertThat(fromSeven).isEqualTo(utc(2024, 9, 8, 9, 0));
            assertThat(fromZero).isEqualTo(fromSeven);
        }

        @Test
        @DisplayName("Successive occurrences should be strictly increasing")
        void successiveOccurrencesShouldIncrease() {
            var cron = CronExpression.parse("*/7 1-3 * * *");
            var current = utc(2024, 1, 1, 0, 0);

            for (var i = 0; i < 200; i++) {
                var next = cron.next(current).orElseThrow();
                assertThat(next).isAfter(current);
                assertThat(cron.matches(next.toLocalDateTime())).isTrue();
                current = next;
            }
        }

        @Test
        @DisplayName("Unsatisfiable expression should have no next occurrence")
        void unsatisfiableExpressionShouldBeEmpty() {
            assertThat(CronExpression.parse("0 0 30 2 *").next(utc(2024, 1, 1, 0, 0))).isEmpty();
        }

        @Test
        @DisplayName("Impossible day-of-month should still fire on the restricted weekday")
        void impossibleDayOfMonthShouldFallBackToWeekday() {
            // 2024-02-05 is a Monday
            assertThat(nextOf("0 0 30 2 MON", utc(2024, 2, 1, 0, 0))).isEqualTo(utc(2024, 2, 5, 0, 0));
        }
    }

    @Nested
    @DisplayName("Day-of-month and day-of-week")
    class DayMatchingTests {

        @Test
        @DisplayName("Both restricted should match either (OR)")
        void bothRestrictedShouldMatchEither() {
            // 2024-09-01 is a Sunday; Friday the 6th comes before the 13th
            var cron = CronExpression.parse("0 0 13 * 5");

            var first = cron.next(utc(2024, 9, 1, 0, 0)).orElseThrow();
            var second = cron.next(first).orElseThrow();
            var third = cron.next(second).orElseThrow();

            assertThat(first).isEqualTo(utc(2024, 9, 6, 0, 0));
            assertThat(second).isEqualTo(utc(2024, 9, 13, 0, 0));
            assertThat(third).isEqualTo(utc(2024, 9, 20, 0, 0));
        }

        @Test
        @DisplayName("Wildcard day-of-month should restrict by day-of-week only (AND)")
        void wildcardDayOfMonthShouldUseDayOfWeek() {
            assertThat(nextOf("0 0 * * MON", utc(2024, 9, 1, 0, 0))).isEqualTo(utc(2024, 9, 2, 0, 0));
        }

        @Test
        @DisplayName("A stepped wildcard still counts as a wildcard")
        void steppedWildcardCountsAsWildcard() {
            // Only odd days that are also Mondays: 2024-09-09 is a Monday on an odd day
            assertThat(nextOf("0 0 */2 * 1", utc(2024, 9, 1, 0, 0))).isEqualTo(utc(2024, 9, 9, 0, 0));
        }

        @Test
        @DisplayName("Wildcard day-of-week should restrict by day-of-month only")
        void wildcardDayOfWeekShouldUseDayOfMonth() {
            assertThat(nextOf("0 0 15 * *", utc(2024, 9, 1, 0, 0))).isEqualTo(utc(2024, 9, 15, 0, 0));
        }

        @Test
        @DisplayName("matches should apply the same rule")
        void matchesShouldApplySameRule() {
            var cron = CronExpression.parse("30 8 1 * SUN");

            assertThat(cron.matches(LocalDateTime.of(2024, 10, 1, 8, 30))).isTrue();
            // 2024-09-08 is a Sunday
            assertThat(cron.matches(LocalDateTime.of(2024, 9, 8, 8, 30))).isTrue();
            assertThat(cron.matches(LocalDateTime.of(2024, 9, 9, 8, 30))).isFalse();
            assertThat(cron.matches(LocalDateTime.of(2024, 10, 1, 8, 31))).isFalse();
        }
    }

    @Nested
    @DisplayName("Daylight saving time")
    class DaylightSavingTests {

        @Test
        @DisplayName("A wall-clock time inside the spring-forward gap should be skipped")
        void gapTimeShouldBeSkipped() {
            // 2024-03-10 02:00 -> 03:00 in New York
            var after = ZonedDateTime.of(2024, 3, 9, 3, 0, 0, 0, NEW_YORK);

            var next = nextOf("30 2 * * *", after);

            assertThat(next.toLocalDateTime()).isEqualTo(LocalDateTime.of(2024, 3, 11, 2, 30));
            assertThat(next.getOffset()).isEqualTo(ZoneOffset.ofHours(-4));
        }

        @Test
        @DisplayName("Hourly schedule should continue after the gap")
        void hourlyScheduleShouldContinueAfterGap() {
            var after = ZonedDateTime.of(2024, 3, 10, 1, 30, 0, 0, NEW_YORK);

            var next = nextOf("0 * * * *", after);

            assertThat(next.toLocalDateTime()).isEqualTo(LocalDateTime.of(2024, 3, 10, 3, 0));
            assertThat(next.toInstant()).isEqualTo(after.toInstant().plusSeconds(30 * 60));
        }

        @Test
        @DisplayName("A repeated wall-clock time should fire once, at the earlier offset")
        void overlapTimeShouldFireOnce() {
            // 2024-11-03 01:00-02:00 happens twice in New York
            var cron = CronExpression.parse("30 1 * * *");
            var after = ZonedDateTime.of(2024, 11, 3, 0, 0, 0, 0, NEW_YORK);

            var first = cron.next(after).orElseThrow();
            var second = cron.next(first).orElseThrow();

            assertThat(first.toLocalDateTime()).isEqualTo(LocalDateTime.of(2024, 11, 3, 1, 30));
            assertThat(first.getOffset()).isEqualTo(ZoneOffset.ofHours(-4));
            assertThat(second.toLocalDateTime()).isEqualTo(LocalDateTime.of(2024, 11, 4, 1, 30));
        }

        @Test
        @DisplayName("Should evaluate in the zone of the reference time")
        void shouldEvaluateInReferenceZone() {
            var after = ZonedDateTime.of(2024, 7, 1, 0, 0, 0, 0, NEW_YORK);

            var next = nextOf("0 9 * * *", after);

            assertThat(next.toInstant()).isEqualTo(utc(2024, 7, 1, 13, 0).toInstant());
        }
    }
}
