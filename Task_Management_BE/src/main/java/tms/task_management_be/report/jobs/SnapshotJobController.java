package tms.task_management_be.report.jobs;

import tms.task_management_be.period.PeriodType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/saved-reports")
@Tag(name = "Saved reports")
public class SnapshotJobController {
    private final SnapshotJobService jobs;

    public SnapshotJobController(SnapshotJobService jobs) { this.jobs = jobs; }

    @PostMapping("/generate")
    @Operation(summary = "Generate saved reports",
            description = "Saves individual and team reports of a finished period. Without a type the previous week, month and year are saved; without a year the previous period of the type.")
    public GenerationSummary generate(
            @Parameter(description = "weekly, monthly or yearly") @RequestParam(required = false) String type,
            @Parameter(description = "Jalali year") @RequestParam(required = false) Integer year,
            @Parameter(description = "Jalali month (monthly)") @RequestParam(required = false) Integer month,
            @Parameter(description = "Jalali week (weekly)") @RequestParam(required = false) Integer week) {
        if (type == null || type.isBlank()) {
            return jobs.generatePreviousPeriods();
        }
        return jobs.generate(PeriodType.parse(type), year, month, week);
    }
}
