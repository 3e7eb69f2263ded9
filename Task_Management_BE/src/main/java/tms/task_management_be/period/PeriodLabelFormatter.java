package tms.task_management_be.period;

import tms.task_management_be.calendar.JalaliMonth;
import tms.task_management_be.calendar.LabelLanguage;

import java.util.Objects;

/**
 * Renders human-readable labels for Jalali periods.
 */
public class PeriodLabelFormatter {
    private final LabelLanguage language;

    public PeriodLabelFormatter(LabelLanguage language) {
        this.language = Objects.requireNonNull(language, "language");
    }

    public String format(PeriodDescriptor descriptor) {
        int year = descriptor.jalaliYear();
        return switch (descriptor.type()) {
            case DAILY -> descriptor.jalaliDay() + " " + monthName(descriptor.jalaliMonth()) + " " + year;
            case WEEKLY -> language == LabelLanguage.EN
                    ? "Week " + descriptor.jalaliWeek() + " of " + year
                    : "هفته " + descriptor.jalaliWeek() + " سال " + year;
            case MONTHLY -> monthName(descriptor.jalaliMonth()) + " " + year;
            case YEARLY -> language == LabelLanguage.EN ? "Year " + year : "سال " + year;
        };
    }

    private String monthName(int month) {
        return JalaliMonth.of(month).displayName(language);
    }
}
