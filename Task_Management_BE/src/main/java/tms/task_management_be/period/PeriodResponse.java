package tms.task_management_be.period;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;

/**
 * Wire form of a resolved period. Boundaries are ISO calendar dates, both inclusive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeriodResponse(String periodType,
                             int jalaliYear,
                             Integer jalaliMonth,
                             Integer jalaliWeek,
                             Integer jalaliDay,
                             LocalDate startDate,
                             LocalDate endDate,
                             String formatted) {

    public static PeriodResponse from(ResolvedPeriod period) {
        PeriodDescriptor descriptor = period.descriptor();
        return new PeriodResponse(
                descriptor.type().wireName(),
                descriptor.jalaliYear(),
                descriptor.jalaliMonth(),
                descriptor.jalaliWeek(),
                descriptor.jalaliDay(),
                period.startDate(),
                period.endDate(),
                period.label());
    }
}
