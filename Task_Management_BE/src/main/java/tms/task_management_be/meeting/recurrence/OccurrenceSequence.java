package tms.task_management_be.meeting.recurrence;

import java.time.OffsetDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable view of the occurrences of one rule. Each element is computed from its index,
 * so iteration may start anywhere and unbounded rules never materialize earlier occurrences.
 */
public final class OccurrenceSequence implements Iterable<OffsetDateTime> {
    static final long UNBOUNDED = Long.MAX_VALUE;

    private final RecurrenceExpander expander;
    private final OffsetDateTime anchor;
    private final RecurrenceRule rule;
    private final long lastIndex;

    OccurrenceSequence(RecurrenceExpander expander, OffsetDateTime anchor, RecurrenceRule rule, long lastIndex) {
        this.expander = expander;
        this.anchor = anchor;
        this.rule = rule;
        this.lastIndex = lastIndex;
    }

    public OffsetDateTime anchor() {
        return anchor;
    }

    public RecurrenceRule rule() {
        return rule;
    }

    public boolean isBounded() {
        return lastIndex != UNBOUNDED;
    }

    /**
     * Number of occurrences, empty for an unbounded rule.
     */
    public OptionalLong size() {
        return isBounded() ? OptionalLong.of(lastIndex + 1) : OptionalLong.empty();
    }

    public Optional<OffsetDateTime> get(long index) {
        if (index < 0 || index > lastIndex) {
            return Optional.empty();
        }
        return Optional.of(expander.occurrence(anchor, rule, index));
    }

    /**
     * Index of the first occurrence at or after {@code time}; may exceed the last index.
     */
    public long indexAtOrAfter(OffsetDateTime time) {
        return expander.firstIndex(anchor, rule, time, true);
    }

    public Iterator<OffsetDateTime> iteratorFrom(long startIndex) {
        return new Iterator<>() {
            private long next = Math.max(0, startIndex);

            @Override
            public boolean hasNext() {
                return next <= lastIndex;
            }

            @Override
            public OffsetDateTime next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return expander.occurrence(anchor, rule, next++);
            }
        };
    }

    public Iterator<OffsetDateTime> iteratorAtOrAfter(OffsetDateTime time) {
        return iteratorFrom(indexAtOrAfter(time));
    }

    @Override
    public Iterator<OffsetDateTime> iterator() {
        return iteratorFrom(0);
    }

    public Stream<OffsetDateTime> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    long lastIndex() {
        return lastIndex;
    }
}
