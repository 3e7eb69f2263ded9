package tms.task_management_be.report;

import tms.task_management_be.period.PeriodDescriptor;
import tms.task_management_be.period.PeriodResolver;
import tms.task_management_be.period.PeriodType;
import tms.task_management_be.period.ResolvedPeriod;
import tms.task_management_be.report.assembly.ReportAssembler;
import tms.task_management_be.report.snapshot.SavedReportEntity;
import tms.task_management_be.report.snapshot.SnapshotKey;
import tms.task_management_be.report.snapshot.SnapshotLifecycleService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.function.Supplier;

/**
 * Serves individual and team reports. Reports of closed weekly, monthly and yearly periods come from
 * their snapshot, which the first request after the period closes creates. Open periods and daily
 * periods are assembled live and never stored.
 */
@Service
public class ReportService {

    private final ReportAssembler assembler;
    private final SnapshotLifecycleService snapshots;
    private final PeriodResolver periodResolver;
    private final ObjectMapper objectMapper;

    public ReportService(ReportAssembler assembler,
                         SnapshotLifecycleService snapshots,
                         PeriodResolver periodResolver,
                         ObjectMapper objectMapper) {
        this.assembler = assembler;
        this.snapshots = snapshots;
        this.periodResolver = periodResolver;
        this.objectMapper = objectMapper;
    }

    public ReportView individualReport(long userId, PeriodDescriptor descriptor) {
        PeriodDescriptor canonical = periodResolver.canonical(descriptor);
        ResolvedPeriod period = periodResolver.resolve(canonical);
        return serve(period,
                () -> SnapshotKey.individual(userId, canonical),
                () -> assembler.assembleIndividual(userId, period));
    }

    public ReportView teamReport(long domainId, PeriodDescriptor descriptor) {
        PeriodDescriptor canonical = periodResolver.canonical(descriptor);
        ResolvedPeriod period = periodResolver.resolve(canonical);
        return serve(period,
                () -> SnapshotKey.team(domainId, canonical),
                () -> assembler.assembleTeam(domainId, period));
    }

    private ReportView serve(ResolvedPeriod period, Supplier<SnapshotKey> key, Supplier<JsonNode> content) {
        if (period.type() != PeriodType.DAILY && snapshots.isClosed(period)) {
            SavedReportEntity saved = snapshots.ensureSnapshot(key.get(), content::get);
            return new ReportView(ReportSource.SNAPSHOT, period, saved.id(), saved.createdAt(), saved.content());
        }
        return new ReportView(ReportSource.LIVE, period, null, null, toJson(content.get()));
    }

    private String toJson(JsonNode content) {
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report content could not be serialized to JSON", e);
        }
    }

    /**
     * A report ready to be returned. {@code content} is JSON text; for snapshots it is the stored text.
     */
    public record ReportView(ReportSource source,
                             ResolvedPeriod period,
                             Long savedReportId,
                             OffsetDateTime savedAt,
                             String content) {
    }
}
