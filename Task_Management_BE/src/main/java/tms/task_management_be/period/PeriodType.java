package tms.task_management_be.period;

import java.util.Locale;

/**
 * Reporting period granularity. The wire form is the lower-case name.
 */
public enum PeriodType {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    public static PeriodType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedPeriodTypeException("Period type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (PeriodType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new UnsupportedPeriodTypeException(
                "Unsupported period type '" + value + "'. Must be daily, weekly, monthly or yearly");
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
