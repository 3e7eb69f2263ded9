package tms.task_management_be.meeting.recurrence;

public class AmbiguousRecurrenceException extends RuntimeException {

    public AmbiguousRecurrenceException(String message) {
        super(message);
    }
}
