package tms.task_management_be.period;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A period descriptor resolved to an inclusive Gregorian date range and a display label.
 */
public record ResolvedPeriod(PeriodDescriptor descriptor,
                             LocalDate startDate,
                             LocalDate endDate,
                             String label) {

    public ResolvedPeriod {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        Objects.requireNonNull(label, "label");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate " + endDate + " is before startDate " + startDate);
        }
    }

    public PeriodType type() {
        return descriptor.type();
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }
}
