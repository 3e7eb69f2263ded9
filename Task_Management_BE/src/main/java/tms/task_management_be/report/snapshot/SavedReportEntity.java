package tms.task_management_be.report.snapshot;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Immutable projection of the <code>saved_report</code> table. {@code content} is the JSON text
 * exactly as it was stored.
 */
public record SavedReportEntity(long id, SnapshotKey key, String content, OffsetDateTime createdAt) {

    public SavedReportEntity {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
