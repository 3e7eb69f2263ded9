package tms.task_management_be.meeting.recurrence;

/**
 * Calendar whose day-of-month and month numbering a monthly or yearly rule keeps.
 * Daily and weekly rules are plain day arithmetic and ignore it.
 */
public enum RecurrenceCalendar {
    GREGORIAN,
    JALALI
}
