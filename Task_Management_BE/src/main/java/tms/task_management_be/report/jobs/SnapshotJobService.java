package tms.task_management_be.report.jobs;

import tms.task_management_be.directory.ScopeDirectoryRepository;
import tms.task_management_be.period.PeriodDescriptor;
import tms.task_management_be.period.PeriodResolver;
import tms.task_management_be.period.PeriodType;
import tms.task_management_be.period.ResolvedPeriod;
import tms.task_management_be.period.UnsupportedPeriodTypeException;
import tms.task_management_be.report.assembly.ReportAssembler;
import tms.task_management_be.report.snapshot.PeriodNotClosedException;
import tms.task_management_be.report.snapshot.ReportContentProducer;
import tms.task_management_be.report.snapshot.SnapshotKey;
import tms.task_management_be.report.snapshot.SnapshotLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Saves the reports of finished periods for every active user and every domain.
 *
 * <p>Scopes that already have a snapshot are skipped. A failure for one scope is logged and counted
 * and the run continues; the next run retries it because nothing was stored.</p>
 */
@Service
public class SnapshotJobService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotJobService.class);

    static final List<PeriodType> SNAPSHOT_TYPES = List.of(PeriodType.WEEKLY, PeriodType.MONTHLY, PeriodType.YEARLY);

    private final ScopeDirectoryRepository directory;
    private final SnapshotLifecycleService snapshots;
    private final ReportAssembler assembler;
    private final PeriodResolver periodResolver;

    public SnapshotJobService(ScopeDirectoryRepository directory,
                              SnapshotLifecycleService snapshots,
                              ReportAssembler assembler,
                              PeriodResolver periodResolver) {
        this.directory = directory;
        this.snapshots = snapshots;
        this.assembler = assembler;
        this.periodResolver = periodResolver;
    }

    /**
     * Snapshots the week, month and year before the current ones.
     */
    public GenerationSummary generatePreviousPeriods() {
        GenerationSummary summary = new GenerationSummary();
        for (PeriodType type : SNAPSHOT_TYPES) {
            summary.merge(generate(type, null, null, null));
        }
        return summary;
    }

    /**
     * Snapshots one period. Without a year the period before the current one of {@code type} is used;
     * with a year the month (monthly) or week (weekly) must be given as well.
     */
    public GenerationSummary generate(PeriodType type, Integer year, Integer month, Integer week) {
        requireSnapshotType(type);
        PeriodDescriptor descriptor = year == null
                ? periodResolver.previous(periodResolver.current(type))
                : new PeriodDescriptor(type, year, month, week, null);
        return generate(descriptor);
    }

    public GenerationSummary generate(PeriodDescriptor requested) {
        requireSnapshotType(requested.type());
        long started = System.currentTimeMillis();
        PeriodDescriptor descriptor = periodResolver.canonical(requested);
        ResolvedPeriod period = periodResolver.resolve(descriptor);
        if (!snapshots.isClosed(period)) {
            throw new PeriodNotClosedException("Period " + period.label() + " ends on " + period.endDate()
                    + " and cannot be saved yet");
        }
        GenerationSummary summary = new GenerationSummary().addPeriod(period.label());
        for (Long userId : directory.listActiveUserIds()) {
            ensure(summary, period, SnapshotKey.individual(userId, descriptor),
                    () -> assembler.assembleIndividual(userId, period));
        }
        for (Long domainId : directory.listDomainIds()) {
            ensure(summary, period, SnapshotKey.team(domainId, descriptor),
                    () -> assembler.assembleTeam(domainId, period));
        }
        summary.durationMs = System.currentTimeMillis() - started;
        log.info("Saved reports for {}: created={}, existing={}, failed={} in {} ms",
                period.label(), summary.created, summary.existing, summary.failed, summary.durationMs);
        return summary;
    }

    private static void requireSnapshotType(PeriodType type) {
        if (!SNAPSHOT_TYPES.contains(type)) {
            throw new UnsupportedPeriodTypeException("Reports of " + type.wireName() + " periods are not saved");
        }
    }

    private void ensure(GenerationSummary summary, ResolvedPeriod period, SnapshotKey key, ReportContentProducer producer) {
        try {
            if (snapshots.findByKey(key).isPresent()) {
                summary.addExisting();
                return;
            }
            snapshots.ensureSnapshot(key, producer);
            summary.addCreated();
        } catch (RuntimeException ex) {
            summary.addFailed();
            log.warn("Saving {} report for {} {} failed: {}", period.label(), key.reportType(),
                    key.userId() != null ? key.userId() : key.domainId(), ex.getMessage(), ex);
        }
    }
}
