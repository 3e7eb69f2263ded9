package tms.task_management_be.report.snapshot;

import tms.task_management_be.web.ApiException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/saved-reports")
@Tag(name = "Saved reports", description = "Read access to report snapshots of closed periods")
public class SavedReportController {
    private final SnapshotLifecycleService snapshots;

    public SavedReportController(SnapshotLifecycleService snapshots) {
        this.snapshots = snapshots;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SavedReportSummary(long id,
                                     String reportType,
                                     String periodType,
                                     int jalaliYear,
                                     Integer jalaliMonth,
                                     Integer jalaliWeek,
                                     Long userId,
                                     Long domainId,
                                     OffsetDateTime createdAt) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SavedReportResponse(SavedReportSummary report, @JsonRawValue String content) {}

    @GetMapping("/{id}")
    @Operation(summary = "Saved report detail", description = "Returns the stored report content exactly as it was saved.")
    public SavedReportResponse get(@PathVariable long id) {
        SavedReportEntity entity = snapshots.findById(id)
                .orElseThrow(() -> ApiException.notFound("Saved report was not found.", "saved_report"));
        return new SavedReportResponse(toSummary(entity), entity.content());
    }

    @GetMapping
    @Operation(summary = "Individual saved reports", description = "Saved individual reports of one user, newest year first.")
    public List<SavedReportSummary> listForUser(
            @Parameter(description = "User id", required = true) @RequestParam long userId) {
        return snapshots.listForUser(userId).stream().map(SavedReportController::toSummary).toList();
    }

    @GetMapping("/team")
    @Operation(summary = "Team saved reports", description = "Saved team reports of one domain, newest year first.")
    public List<SavedReportSummary> listForDomain(
            @Parameter(description = "Domain id", required = true) @RequestParam long domainId) {
        return snapshots.listForDomain(domainId).stream().map(SavedReportController::toSummary).toList();
    }

    private static SavedReportSummary toSummary(SavedReportEntity entity) {
        SnapshotKey key = entity.key();
        return new SavedReportSummary(
                entity.id(),
                key.reportType().name().toLowerCase(Locale.ROOT),
                key.periodType().wireName(),
                key.jalaliYear(),
                key.jalaliMonth(),
                key.jalaliWeek(),
                key.userId(),
                key.domainId(),
                entity.createdAt());
    }
}
