package tms.task_management_be.meeting;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import tms.task_management_be.period.PeriodDescriptor;
import tms.task_management_be.period.PeriodResponse;
import tms.task_management_be.period.PeriodType;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/meetings/{meetingId}/occurrences")
@Tag(name = "Meeting occurrences", description = "Occurrences of recurring meetings")
public class MeetingController {
    private final MeetingService service;

    public MeetingController(MeetingService service) {
        this.service = service;
    }

    public record OccurrencesResponse(long meetingId,
                                      String topic,
                                      String recurrenceType,
                                      OffsetDateTime reference,
                                      List<OffsetDateTime> occurrences) {}

    public record OccurrenceWithinResponse(long meetingId,
                                           PeriodResponse period,
                                           OffsetDateTime occurrence,
                                           boolean occurs) {}

    @GetMapping
    @Operation(summary = "Next occurrences", description = "Returns up to `count` occurrences at or after `from` (default: now).")
    public OccurrencesResponse next(
            @PathVariable long meetingId,
            @Parameter(description = "Number of occurrences (1-50, default 3)") @RequestParam(required = false) Integer count,
            @Parameter(description = "Reference time (ISO date-time)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from) {
        MeetingService.NextOccurrences result = service.nextOccurrences(meetingId, count, from);
        return new OccurrencesResponse(
                result.meeting().id(),
                result.meeting().topic(),
                result.meeting().recurrence().type().name().toLowerCase(Locale.ROOT),
                result.reference(),
                result.occurrences());
    }

    @GetMapping("/within")
    @Operation(summary = "Occurrence in period", description = "Returns the occurrence of the meeting that falls inside a Jalali period, if any.")
    public OccurrenceWithinResponse within(
            @PathVariable long meetingId,
            @RequestParam String type,
            @RequestParam int year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer week,
            @RequestParam(required = false) Integer day) {
        PeriodDescriptor descriptor = new PeriodDescriptor(PeriodType.parse(type), year, month, week, day);
        MeetingService.OccurrenceInPeriod result = service.occurrenceWithin(meetingId, descriptor);
        return new OccurrenceWithinResponse(
                result.meeting().id(),
                PeriodResponse.from(result.period()),
                result.occurrence(),
                result.occurrence() != null);
    }
}
