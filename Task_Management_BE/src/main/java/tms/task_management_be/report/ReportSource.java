package tms.task_management_be.report;

public enum ReportSource {
    /** Served from a saved report of a closed period. */
    SNAPSHOT,
    /** Assembled from current data; nothing was stored. */
    LIVE
}
