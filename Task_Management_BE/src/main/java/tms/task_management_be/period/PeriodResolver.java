package tms.task_management_be.period;

import tms.task_management_be.calendar.CalendarConverter;
import tms.task_management_be.calendar.InvalidDateException;
import tms.task_management_be.calendar.JalaliDate;
import tms.task_management_be.calendar.JalaliMonth;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Turns Jalali period descriptors into inclusive Gregorian date ranges.
 *
 * <p>Weekly periods use the Saturday-based numbering of {@link CalendarConverter#weekOfYear}:
 * week {@code n} starts {@code n - 1} weeks after the first Saturday on or after Farvardin 1, and
 * week 0 is the Saturday-to-Friday window ending the day before week 1.</p>
 */
public class PeriodResolver {

    private final CalendarConverter converter;
    private final PeriodLabelFormatter labelFormatter;

    public PeriodResolver(CalendarConverter converter, PeriodLabelFormatter labelFormatter) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.labelFormatter = Objects.requireNonNull(labelFormatter, "labelFormatter");
    }

    public ResolvedPeriod resolve(PeriodDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        int year = descriptor.jalaliYear();
        LocalDate start;
        LocalDate end;
        switch (descriptor.type()) {
            case DAILY -> {
                int month = require(descriptor.jalaliMonth(), "month", descriptor);
                int day = require(descriptor.jalaliDay(), "day", descriptor);
                start = converter.toGregorian(JalaliDate.of(year, month, day));
                end = start;
            }
            case WEEKLY -> {
                int week = require(descriptor.jalaliWeek(), "week", descriptor);
                int weeks = converter.weeksInYear(year);
                if (week < 0 || week > weeks) {
                    throw new InvalidDateException(
                            "Jalali year " + year + " has weeks 0.." + weeks + ", got week " + week);
                }
                start = converter.firstSaturday(year).plusWeeks(week - 1L);
                end = start.plusDays(6);
            }
            case MONTHLY -> {
                int month = require(descriptor.jalaliMonth(), "month", descriptor);
                start = converter.toGregorian(JalaliDate.of(year, month, 1));
                end = converter.toGregorian(JalaliDate.of(year, month, converter.daysInMonth(year, month)));
            }
            case YEARLY -> {
                start = converter.toGregorian(JalaliDate.of(year, 1, 1));
                end = converter.toGregorian(JalaliDate.of(year, 12, converter.daysInMonth(year, 12)));
            }
            default -> throw new UnsupportedPeriodTypeException("Unsupported period type " + descriptor.type());
        }
        return new ResolvedPeriod(descriptor, start, end, labelFormatter.format(descriptor));
    }

    /**
     * Moves an already selected period to another year and/or month. A selected day that does not
     * exist in the target month is clamped to the month's last day.
     *
     * @param newMonth target month, or {@code null} to keep the previously selected month
     */
    public PeriodDescriptor reselect(PeriodDescriptor previous, int newYear, Integer newMonth) {
        Objects.requireNonNull(previous, "previous");
        Integer month = newMonth != null ? newMonth : previous.jalaliMonth();
        Integer day = previous.jalaliDay();
        if (month != null) {
            JalaliMonth.of(month);
            if (day != null) {
                day = Math.min(day, converter.daysInMonth(newYear, month));
            }
        }
        return new PeriodDescriptor(previous.type(), newYear, month, previous.jalaliWeek(), day);
    }

    public ResolvedPeriod resolveReselected(PeriodDescriptor previous, int newYear, Integer newMonth) {
        return resolve(reselect(previous, newYear, newMonth));
    }

    /**
     * Descriptor of the period of the given type that contains a Gregorian date. Days that fall in
     * week 0 are reported as the last week of the previous Jalali year.
     */
    public PeriodDescriptor containing(PeriodType type, LocalDate date) {
        Objects.requireNonNull(type, "type");
        JalaliDate jalali = converter.toJalali(date);
        return switch (type) {
            case DAILY -> PeriodDescriptor.daily(jalali.year(), jalali.month(), jalali.day());
            case WEEKLY -> {
                int week = converter.weekOfYear(jalali);
                if (week > 0) {
                    yield PeriodDescriptor.weekly(jalali.year(), week);
                }
                int previousYear = jalali.year() - 1;
                long days = ChronoUnit.DAYS.between(converter.firstSaturday(previousYear), date);
                yield PeriodDescriptor.weekly(previousYear, (int) (days / 7) + 1);
            }
            case MONTHLY -> PeriodDescriptor.monthly(jalali.year(), jalali.month());
            case YEARLY -> PeriodDescriptor.yearly(jalali.year());
        };
    }

    public PeriodDescriptor current(PeriodType type) {
        return containing(type, converter.toGregorian(converter.today()));
    }

    /**
     * Descriptor of the period of the same type that ends the day before this one starts.
     */
    public PeriodDescriptor previous(PeriodDescriptor descriptor) {
        ResolvedPeriod resolved = resolve(descriptor);
        return containing(descriptor.type(), resolved.startDate().minusDays(1));
    }

    /**
     * The single descriptor naming this period's date range. Fields that do not belong to the type
     * are dropped, and week 0 becomes the last week of the previous year, so two descriptors that
     * resolve to the same window are equal afterwards.
     */
    public PeriodDescriptor canonical(PeriodDescriptor descriptor) {
        ResolvedPeriod resolved = resolve(descriptor);
        return containing(descriptor.type(), resolved.startDate());
    }

    private static int require(Integer value, String field, PeriodDescriptor descriptor) {
        if (value == null) {
            throw new InvalidDateException(
                    "Jalali " + field + " is required for a " + descriptor.type().wireName() + " period");
        }
        return value;
    }
}
