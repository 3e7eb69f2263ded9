package tms.task_management_be.report.snapshot;

public enum ReportType {
    INDIVIDUAL,
    TEAM
}
