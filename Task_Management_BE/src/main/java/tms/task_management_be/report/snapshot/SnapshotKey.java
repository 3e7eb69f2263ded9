package tms.task_management_be.report.snapshot;

import tms.task_management_be.period.PeriodDescriptor;
import tms.task_management_be.period.PeriodType;
import tms.task_management_be.period.UnsupportedPeriodTypeException;

import java.util.Objects;

/**
 * Identity of a saved report. At most one snapshot exists per key.
 *
 * <p>Individual keys carry a user id, team keys a domain id, never both. Weekly keys carry a week,
 * monthly keys a month, yearly keys neither; fields that do not belong to the period type are
 * dropped so equal periods always produce equal keys. Daily periods are not snapshotted.</p>
 */
public record SnapshotKey(ReportType reportType,
                          PeriodType periodType,
                          int jalaliYear,
                          Integer jalaliMonth,
                          Integer jalaliWeek,
                          Long userId,
                          Long domainId) {

    public SnapshotKey {
        Objects.requireNonNull(reportType, "reportType");
        Objects.requireNonNull(periodType, "periodType");
        switch (periodType) {
            case WEEKLY -> {
                Objects.requireNonNull(jalaliWeek, "jalaliWeek");
                jalaliMonth = null;
            }
            case MONTHLY -> {
                Objects.requireNonNull(jalaliMonth, "jalaliMonth");
                jalaliWeek = null;
            }
            case YEARLY -> {
                jalaliMonth = null;
                jalaliWeek = null;
            }
            default -> throw new UnsupportedPeriodTypeException(
                    "Reports of " + periodType.wireName() + " periods are not saved");
        }
        if (reportType == ReportType.INDIVIDUAL && (userId == null || domainId != null)) {
            throw new IllegalArgumentException("An individual report key needs a user id and no domain id");
        }
        if (reportType == ReportType.TEAM && (domainId == null || userId != null)) {
            throw new IllegalArgumentException("A team report key needs a domain id and no user id");
        }
    }

    public static SnapshotKey individual(long userId, PeriodDescriptor period) {
        return new SnapshotKey(ReportType.INDIVIDUAL, period.type(), period.jalaliYear(),
                period.jalaliMonth(), period.jalaliWeek(), userId, null);
    }

    public static SnapshotKey team(long domainId, PeriodDescriptor period) {
        return new SnapshotKey(ReportType.TEAM, period.type(), period.jalaliYear(),
                period.jalaliMonth(), period.jalaliWeek(), null, domainId);
    }

    public PeriodDescriptor toDescriptor() {
        return new PeriodDescriptor(periodType, jalaliYear, jalaliMonth, jalaliWeek, null);
    }
}
