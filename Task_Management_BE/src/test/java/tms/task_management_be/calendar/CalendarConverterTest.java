package tms.task_management_be.calendar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarConverterTest {

    private static final ZoneId TEHRAN = ZoneId.of("Asia/Tehran");

    private final CalendarConverter converter =
            new CalendarConverter(TEHRAN, Clock.fixed(Instant.parse("2024-06-15T08:00:00Z"), TEHRAN));

    @ParameterizedTest
    @CsvSource({
            "1403, 1, 1, 2024-03-20",
            "1402, 1, 1, 2023-03-21",
            "1404, 1, 1, 2025-03-21",
            "1403, 12, 30, 2025-03-20",
            "1404, 7, 1, 2025-09-23",
            "1402, 10, 11, 2024-01-01",
            "1399, 12, 30, 2021-03-20"
    })
    void convertsKnownDates(int year, int month, int day, String gregorian) {
        LocalDate expected = LocalDate.parse(gregorian);

        assertThat(converter.toGregorian(year, month, day)).isEqualTo(expected);
        assertThat(converter.toJalali(expected)).isEqualTo(JalaliDate.of(year, month, day));
    }

    @Test
    void roundTripsEveryDayAcrossSeveralCycles() {
        LocalDate date = LocalDate.of(1990, 1, 1);
        LocalDate end = LocalDate.of(2060, 12, 31);
        JalaliDate previous = null;
        while (!date.isAfter(end)) {
            JalaliDate jalali = converter.toJalali(date);
            assertThat(converter.toGregorian(jalali)).isEqualTo(date);
            if (previous != null) {
                assertThat(jalali).isGreaterThan(previous);
            }
            previous = jalali;
            date = date.plusDays(1);
        }
    }

    @Test
    void leapYearsFollowThirtyThreeYearCycle() {
        assertThat(converter.isLeapYear(1399)).isTrue();
        assertThat(converter.isLeapYear(1403)).isTrue();
        assertThat(converter.isLeapYear(1404)).isFalse();
        assertThat(converter.isLeapYear(1408)).isTrue();
        assertThat(converter.daysInYear(1403)).isEqualTo(366);
        assertThat(converter.daysInYear(1404)).isEqualTo(365);
        assertThat(converter.daysInMonth(1403, 12)).isEqualTo(30);
        assertThat(converter.daysInMonth(1404, 12)).isEqualTo(29);
        assertThat(converter.daysInMonth(1404, 6)).isEqualTo(31);
        assertThat(converter.daysInMonth(1404, 7)).isEqualTo(30);
    }

    @Test
    void weeksStartOnFirstSaturdayOfYear() {
        assertThat(converter.firstSaturday(1403)).isEqualTo(LocalDate.of(2024, 3, 23));
        assertThat(converter.weekOfYear(JalaliDate.of(1403, 1, 1))).isZero();
        assertThat(converter.weekOfYear(JalaliDate.of(1403, 1, 3))).isZero();
        assertThat(converter.weekOfYear(JalaliDate.of(1403, 1, 4))).isEqualTo(1);
        assertThat(converter.weekOfYear(JalaliDate.of(1403, 1, 10))).isEqualTo(1);
        assertThat(converter.weekOfYear(JalaliDate.of(1403, 1, 11))).isEqualTo(2);
        assertThat(converter.weeksInYear(1403)).isEqualTo(52);
    }

    @Test
    void todayUsesConfiguredZone() {
        // 22:00 UTC on 19 March is already 20 March (Nowruz 1403) in Tehran.
        Clock lateEvening = Clock.fixed(Instant.parse("2024-03-19T22:00:00Z"), ZoneOffset.UTC);
        CalendarConverter tehran = new CalendarConverter(TEHRAN, lateEvening);
        CalendarConverter utc = new CalendarConverter(ZoneOffset.UTC, lateEvening);

        assertThat(tehran.today()).isEqualTo(JalaliDate.of(1403, 1, 1));
        assertThat(utc.today()).isEqualTo(JalaliDate.of(1402, 12, 29));
        assertThat(converter.toJalali(OffsetDateTime.parse("2024-03-19T22:00:00Z"))).isEqualTo(JalaliDate.of(1403, 1, 1));
    }

    @Test
    void rejectsInvalidDates() {
        assertThatThrownBy(() -> converter.toGregorian(1404, 12, 30)).isInstanceOf(InvalidDateException.class);
        assertThatThrownBy(() -> converter.toGregorian(1403, 13, 1)).isInstanceOf(InvalidDateException.class);
        assertThatThrownBy(() -> converter.toGregorian(1403, 7, 31)).isInstanceOf(InvalidDateException.class);
        assertThatThrownBy(() -> converter.toGregorian(1403, 1, 0)).isInstanceOf(InvalidDateException.class);
        assertThatThrownBy(() -> converter.toGregorian(0, 1, 1)).isInstanceOf(InvalidDateException.class);
        assertThatThrownBy(() -> converter.toJalali(CalendarConverter.MIN_SUPPORTED_DATE.minusDays(1)))
                .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void supportedRangeEndsConvertBothWays() {
        assertThat(converter.toJalali(CalendarConverter.MIN_SUPPORTED_DATE)).isEqualTo(JalaliDate.of(1, 1, 1));
        JalaliDate last = converter.toJalali(CalendarConverter.MAX_SUPPORTED_DATE);
        assertThat(last.year()).isEqualTo(JalaliDate.MAX_YEAR);
        assertThat(last.month()).isEqualTo(12);
    }

    @Test
    void monthNamesInBothLanguages() {
        assertThat(JalaliDate.of(1403, 1, 1).monthName().displayName(LabelLanguage.FA)).isEqualTo("فروردین");
        assertThat(JalaliDate.of(1403, 12, 1).monthName().displayName(LabelLanguage.EN)).isEqualTo("Esfand");
        assertThat(JalaliDate.of(1403, 1, 9).toString()).isEqualTo("1403/01/09");
    }
}
