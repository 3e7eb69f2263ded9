package tms.task_management_be.period;

public class UnsupportedPeriodTypeException extends RuntimeException {

    public UnsupportedPeriodTypeException(String message) {
        super(message);
    }
}
