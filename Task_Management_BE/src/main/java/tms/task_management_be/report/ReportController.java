package tms.task_management_be.report;

import tms.task_management_be.period.PeriodDescriptor;
import tms.task_management_be.period.PeriodResponse;
import tms.task_management_be.period.PeriodType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.Locale;

@RestController
@RequestMapping("/api/reports")
@Tag(name = "Reports", description = "Individual and team reports for Jalali periods")
public class ReportController {
    private final ReportService service;

    public ReportController(ReportService service) {
        this.service = service;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ReportResponse(String source,
                                 PeriodResponse period,
                                 Long savedReportId,
                                 OffsetDateTime savedAt,
                                 @JsonRawValue String content) {}

    @GetMapping("/individual")
    @Operation(summary = "Individual report",
            description = "Closed weekly, monthly and yearly periods are served from their saved report; other periods are assembled live.")
    public ReportResponse individual(
            @Parameter(description = "User id", required = true) @RequestParam long userId,
            @Parameter(description = "daily, weekly, monthly or yearly", required = true) @RequestParam String type,
            @RequestParam int year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer week,
            @RequestParam(required = false) Integer day) {
        PeriodDescriptor descriptor = new PeriodDescriptor(PeriodType.parse(type), year, month, week, day);
        return toResponse(service.individualReport(userId, descriptor));
    }

    @GetMapping("/team")
    @Operation(summary = "Team report", description = "Report of a domain for a weekly, monthly or yearly period.")
    public ReportResponse team(
            @Parameter(description = "Domain id", required = true) @RequestParam long domainId,
            @Parameter(description = "weekly, monthly or yearly", required = true) @RequestParam String type,
            @RequestParam int year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer week) {
        PeriodDescriptor descriptor = new PeriodDescriptor(PeriodType.parse(type), year, month, week, null);
        return toResponse(service.teamReport(domainId, descriptor));
    }

    private static ReportResponse toResponse(ReportService.ReportView view) {
        return new ReportResponse(
                view.source().name().toLowerCase(Locale.ROOT),
                PeriodResponse.from(view.period()),
                view.savedReportId(),
                view.savedAt(),
                view.content());
    }
}
