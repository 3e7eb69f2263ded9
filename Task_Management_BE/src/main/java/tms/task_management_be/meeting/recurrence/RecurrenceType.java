package tms.task_management_be.meeting.recurrence;

import java.util.Locale;

public enum RecurrenceType {
    NONE,
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    public static RecurrenceType parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
