package tms.task_management_be.calendar;

/**
 * Raised when a Jalali date, or a period built from Jalali fields, does not exist in the calendar.
 */
public class InvalidDateException extends RuntimeException {

    public InvalidDateException(String message) {
        super(message);
    }
}
