package tms.task_management_be.report.snapshot;

/**
 * Raised when a snapshot is requested for a period whose last day has not passed yet.
 */
public class PeriodNotClosedException extends RuntimeException {

    public PeriodNotClosedException(String message) {
        super(message);
    }
}
