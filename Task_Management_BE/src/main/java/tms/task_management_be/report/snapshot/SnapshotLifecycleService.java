package tms.task_management_be.report.snapshot;

import tms.task_management_be.period.PeriodResolver;
import tms.task_management_be.period.ResolvedPeriod;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Creates report snapshots once their period has closed and serves them afterwards.
 *
 * <p>A snapshot is written at most once per {@link SnapshotKey}. Concurrent callers race on the
 * table's unique key: the first insert wins, every other caller discards its own content and returns
 * the stored row. No locks are held while the content is produced.</p>
 */
@Service
public class SnapshotLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotLifecycleService.class);

    private final SavedReportRepository repository;
    private final PeriodResolver periodResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SnapshotLifecycleService(SavedReportRepository repository,
                                    PeriodResolver periodResolver,
                                    ObjectMapper objectMapper,
                                    Clock clock) {
        this.repository = repository;
        this.periodResolver = periodResolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * A period is closed once its last day lies strictly before today in the configured zone.
     */
    public boolean isClosed(ResolvedPeriod period) {
        return period.endDate().isBefore(LocalDate.now(clock));
    }

    /**
     * Returns the snapshot for {@code key}, producing and storing it first if none exists.
     *
     * @throws PeriodNotClosedException if no snapshot exists and the period is still open
     */
    public SavedReportEntity ensureSnapshot(SnapshotKey key, ReportContentProducer producer) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(producer, "producer");
        Optional<SavedReportEntity> existing = repository.findByKey(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        ResolvedPeriod period = periodResolver.resolve(key.toDescriptor());
        if (!isClosed(period)) {
            throw new PeriodNotClosedException("Period " + period.label() + " ends on " + period.endDate()
                    + " and cannot be saved before it has closed");
        }
        String content = serialize(producer.produce());
        Optional<SavedReportEntity> inserted = repository.insertIfAbsent(key, content);
        if (inserted.isPresent()) {
            SavedReportEntity saved = inserted.get();
            log.info("Saved report {} created for {} {} ({})", saved.id(), key.reportType(),
                    scopeId(key), period.label());
            return saved;
        }
        log.warn("Saved report for {} {} ({}) was created concurrently, returning the stored one",
                key.reportType(), scopeId(key), period.label());
        return repository.findByKey(key)
                .orElseThrow(() -> new IllegalStateException("Saved report for " + key
                        + " was reported as existing but could not be read back"));
    }

    public Optional<SavedReportEntity> findByKey(SnapshotKey key) {
        return repository.findByKey(key);
    }

    public Optional<SavedReportEntity> findById(long id) {
        return repository.findById(id);
    }

    public List<SavedReportEntity> listForUser(long userId) {
        return repository.listForUser(userId);
    }

    public List<SavedReportEntity> listForDomain(long domainId) {
        return repository.listForDomain(domainId);
    }

    private String serialize(Object content) {
        if (content == null) {
            throw new IllegalStateException("Report producer returned no content");
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report content could not be serialized to JSON", e);
        }
    }

    private static long scopeId(SnapshotKey key) {
        return key.reportType() == ReportType.INDIVIDUAL ? key.userId() : key.domainId();
    }
}
