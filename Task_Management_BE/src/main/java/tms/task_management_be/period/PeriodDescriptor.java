package tms.task_management_be.period;

import java.util.Objects;

/**
 * The Jalali fields that identify a reporting window. Which fields are read depends on the type:
 * daily uses year, month and day; weekly uses year and week; monthly uses year and month; yearly
 * uses the year only. Fields that do not belong to the type are carried along untouched.
 */
public record PeriodDescriptor(PeriodType type,
                               int jalaliYear,
                               Integer jalaliMonth,
                               Integer jalaliWeek,
                               Integer jalaliDay) {

    public PeriodDescriptor {
        Objects.requireNonNull(type, "type");
    }

    public static PeriodDescriptor daily(int year, int month, int day) {
        return new PeriodDescriptor(PeriodType.DAILY, year, month, null, day);
    }

    public static PeriodDescriptor weekly(int year, int week) {
        return new PeriodDescriptor(PeriodType.WEEKLY, year, null, week, null);
    }

    public static PeriodDescriptor monthly(int year, int month) {
        return new PeriodDescriptor(PeriodType.MONTHLY, year, month, null, null);
    }

    public static PeriodDescriptor yearly(int year) {
        return new PeriodDescriptor(PeriodType.YEARLY, year, null, null, null);
    }
}
