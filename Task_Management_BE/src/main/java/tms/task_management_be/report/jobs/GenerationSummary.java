package tms.task_management_be.report.jobs;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters of one snapshot generation run.
 */
public class GenerationSummary {
    public int created;
    public int existing;
    public int failed;
    public long durationMs;
    public final List<String> periods = new ArrayList<>();

    public GenerationSummary addCreated() { this.created += 1; return this; }
    public GenerationSummary addExisting() { this.existing += 1; return this; }
    public GenerationSummary addFailed() { this.failed += 1; return this; }

    public GenerationSummary addPeriod(String label) {
        this.periods.add(label);
        return this;
    }

    public GenerationSummary merge(GenerationSummary other) {
        this.created += other.created;
        this.existing += other.existing;
        this.failed += other.failed;
        this.periods.addAll(other.periods);
        return this;
    }
}
