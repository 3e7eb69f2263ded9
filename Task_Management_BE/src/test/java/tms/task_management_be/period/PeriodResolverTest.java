package tms.task_management_be.period;

import tms.task_management_be.calendar.CalendarConverter;
import tms.task_management_be.calendar.InvalidDateException;
import tms.task_management_be.calendar.LabelLanguage;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeriodResolverTest {

    private static final ZoneId TEHRAN = ZoneId.of("Asia/Tehran");

    private final CalendarConverter converter =
            new CalendarConverter(TEHRAN, Clock.fixed(Instant.parse("2025-04-01T09:00:00Z"), TEHRAN));
    private final PeriodResolver resolver = new PeriodResolver(converter, new PeriodLabelFormatter(LabelLanguage.EN));

    @Test
    void firstWeekStartsOnFirstSaturday() {
        ResolvedPeriod week = resolver.resolve(PeriodDescriptor.weekly(1403, 1));

        assertThat(week.startDate()).isEqualTo(LocalDate.of(2024, 3, 23));
        assertThat(week.endDate()).isEqualTo(LocalDate.of(2024, 3, 29));
        assertThat(week.label()).isEqualTo("Week 1 of 1403");
    }

    @Test
    void weekZeroEndsTheDayBeforeWeekOne() {
        ResolvedPeriod week = resolver.resolve(PeriodDescriptor.weekly(1403, 0));

        assertThat(week.startDate()).isEqualTo(LocalDate.of(2024, 3, 16));
        assertThat(week.endDate()).isEqualTo(LocalDate.of(2024, 3, 22));
        assertThat(week.contains(LocalDate.of(2024, 3, 20))).isTrue();
    }

    @Test
    void weekOutsideYearIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(PeriodDescriptor.weekly(1403, 53)))
                .isInstanceOf(InvalidDateException.class);
        assertThatThrownBy(() -> resolver.resolve(PeriodDescriptor.weekly(1403, -1)))
                .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void yearlyPeriodCoversLeapEsfand() {
        ResolvedPeriod leap = resolver.resolve(PeriodDescriptor.yearly(1403));
        ResolvedPeriod common = resolver.resolve(PeriodDescriptor.yearly(1404));

        assertThat(leap.startDate()).isEqualTo(LocalDate.of(2024, 3, 20));
        assertThat(leap.endDate()).isEqualTo(LocalDate.of(2025, 3, 20));
        assertThat(leap.lengthInDays()).isEqualTo(366);
        assertThat(common.startDate()).isEqualTo(LocalDate.of(2025, 3, 21));
        assertThat(common.endDate()).isEqualTo(LocalDate.of(2026, 3, 20));
        assertThat(common.lengthInDays()).isEqualTo(365);
    }

    @Test
    void monthlyPeriods() {
        ResolvedPeriod farvardin = resolver.resolve(PeriodDescriptor.monthly(1404, 1));
        ResolvedPeriod esfand = resolver.resolve(PeriodDescriptor.monthly(1403, 12));

        assertThat(farvardin.startDate()).isEqualTo(LocalDate.of(2025, 3, 21));
        assertThat(farvardin.endDate()).isEqualTo(LocalDate.of(2025, 4, 20));
        assertThat(farvardin.label()).isEqualTo("Farvardin 1404");
        assertThat(esfand.startDate()).isEqualTo(LocalDate.of(2025, 2, 19));
        assertThat(esfand.endDate()).isEqualTo(LocalDate.of(2025, 3, 20));
    }

    @Test
    void dailyPeriodIsSingleDay() {
        ResolvedPeriod day = resolver.resolve(PeriodDescriptor.daily(1403, 1, 1));

        assertThat(day.startDate()).isEqualTo(LocalDate.of(2024, 3, 20));
        assertThat(day.endDate()).isEqualTo(day.startDate());
        assertThat(day.label()).isEqualTo("1 Farvardin 1403");
    }

    @Test
    void missingFieldsAreRejected() {
        assertThatThrownBy(() -> resolver.resolve(new PeriodDescriptor(PeriodType.MONTHLY, 1403, null, null, null)))
                .isInstanceOf(InvalidDateException.class)
                .hasMessageContaining("month");
        assertThatThrownBy(() -> resolver.resolve(new PeriodDescriptor(PeriodType.WEEKLY, 1403, null, null, null)))
                .isInstanceOf(InvalidDateException.class)
                .hasMessageContaining("week");
        assertThatThrownBy(() -> resolver.resolve(PeriodDescriptor.daily(1404, 12, 30)))
                .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void unknownPeriodTypeIsRejected() {
        assertThatThrownBy(() -> PeriodType.parse("quarterly")).isInstanceOf(UnsupportedPeriodTypeException.class);
        assertThatThrownBy(() -> PeriodType.parse(" ")).isInstanceOf(UnsupportedPeriodTypeException.class);
        assertThat(PeriodType.parse(" Weekly ")).isEqualTo(PeriodType.WEEKLY);
    }

    @Test
    void reselectClampsDayToTargetMonth() {
        PeriodDescriptor lastDayOfLeapYear = PeriodDescriptor.daily(1403, 12, 30);

        PeriodDescriptor moved = resolver.reselect(lastDayOfLeapYear, 1404, null);
        assertThat(moved).isEqualTo(PeriodDescriptor.daily(1404, 12, 29));
        assertThat(resolver.resolve(moved).startDate()).isEqualTo(LocalDate.of(2026, 3, 20));

        PeriodDescriptor toMehr = resolver.reselect(PeriodDescriptor.daily(1403, 6, 31), 1403, 7);
        assertThat(toMehr).isEqualTo(PeriodDescriptor.daily(1403, 7, 30));

        PeriodDescriptor monthly = resolver.reselect(PeriodDescriptor.monthly(1403, 5), 1402, 2);
        assertThat(monthly).isEqualTo(PeriodDescriptor.monthly(1402, 2));
    }

    @Test
    void containingMapsWeekZeroToPreviousYear() {
        assertThat(resolver.containing(PeriodType.WEEKLY, LocalDate.of(2024, 3, 21)))
                .isEqualTo(PeriodDescriptor.weekly(1402, 52));
        assertThat(resolver.containing(PeriodType.WEEKLY, LocalDate.of(2024, 3, 25)))
                .isEqualTo(PeriodDescriptor.weekly(1403, 1));
        assertThat(resolver.containing(PeriodType.MONTHLY, LocalDate.of(2025, 3, 20)))
                .isEqualTo(PeriodDescriptor.monthly(1403, 12));
        assertThat(resolver.containing(PeriodType.YEARLY, LocalDate.of(2025, 3, 21)))
                .isEqualTo(PeriodDescriptor.yearly(1404));
    }

    @Test
    void canonicalMergesWeekZeroIntoPreviousYear() {
        PeriodDescriptor weekZero = PeriodDescriptor.weekly(1403, 0);

        assertThat(resolver.canonical(weekZero)).isEqualTo(PeriodDescriptor.weekly(1402, 52));
        assertThat(resolver.resolve(resolver.canonical(weekZero)).startDate())
                .isEqualTo(resolver.resolve(weekZero).startDate());
        // Farvardin 1 of 1405 is a Saturday, so its week 0 lies entirely in 1404
        assertThat(resolver.canonical(PeriodDescriptor.weekly(1405, 0))).isEqualTo(PeriodDescriptor.weekly(1404, 52));
        assertThat(resolver.canonical(PeriodDescriptor.weekly(1403, 20))).isEqualTo(PeriodDescriptor.weekly(1403, 20));
    }

    @Test
    void canonicalDropsFieldsTheTypeDoesNotRead() {
        PeriodDescriptor monthly = new PeriodDescriptor(PeriodType.MONTHLY, 1403, 1, 7, 31);
        PeriodDescriptor yearly = new PeriodDescriptor(PeriodType.YEARLY, 1403, 5, 2, 9);

        assertThat(resolver.canonical(monthly)).isEqualTo(PeriodDescriptor.monthly(1403, 1));
        assertThat(resolver.canonical(yearly)).isEqualTo(PeriodDescriptor.yearly(1403));
        assertThat(resolver.canonical(PeriodDescriptor.daily(1403, 12, 30))).isEqualTo(PeriodDescriptor.daily(1403, 12, 30));
    }

    @Test
    void previousPeriodCrossesYearBoundary() {
        assertThat(resolver.previous(PeriodDescriptor.monthly(1404, 1))).isEqualTo(PeriodDescriptor.monthly(1403, 12));
        assertThat(resolver.previous(PeriodDescriptor.weekly(1403, 1))).isEqualTo(PeriodDescriptor.weekly(1402, 52));
        assertThat(resolver.previous(PeriodDescriptor.yearly(1404))).isEqualTo(PeriodDescriptor.yearly(1403));
    }

    @Test
    void currentUsesClock() {
        // 2025-04-01 is 1404/01/12
        assertThat(resolver.current(PeriodType.MONTHLY)).isEqualTo(PeriodDescriptor.monthly(1404, 1));
        assertThat(resolver.current(PeriodType.DAILY)).isEqualTo(PeriodDescriptor.daily(1404, 1, 12));
    }

    @Test
    void persianLabels() {
        PeriodLabelFormatter persian = new PeriodLabelFormatter(LabelLanguage.FA);

        assertThat(persian.format(PeriodDescriptor.weekly(1403, 5))).isEqualTo("هفته 5 سال 1403");
        assertThat(persian.format(PeriodDescriptor.monthly(1403, 1))).isEqualTo("فروردین 1403");
        assertThat(persian.format(PeriodDescriptor.yearly(1403))).isEqualTo("سال 1403");
    }
}
