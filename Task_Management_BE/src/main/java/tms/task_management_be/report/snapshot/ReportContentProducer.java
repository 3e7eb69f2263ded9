package tms.task_management_be.report.snapshot;

/**
 * Builds the content of a report at the moment its snapshot is taken. The returned value is
 * serialized to JSON once and stored verbatim.
 */
@FunctionalInterface
public interface ReportContentProducer {

    Object produce();
}
