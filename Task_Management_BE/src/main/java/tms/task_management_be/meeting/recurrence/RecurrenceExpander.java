package tms.task_management_be.meeting.recurrence;

import tms.task_management_be.calendar.CalendarConverter;
import tms.task_management_be.calendar.JalaliDate;
import tms.task_management_be.period.ResolvedPeriod;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expands a meeting's anchor datetime and recurrence rule into occurrences.
 *
 * <p>Occurrence {@code k} is computed directly as {@code anchor + k * interval} units, using
 * wall-clock arithmetic in the converter's zone so a meeting keeps its local start time. Monthly and
 * yearly rules keep the anchor's day-of-month in the rule's calendar and clamp it to the last day of
 * shorter months. Lookups by time jump to an estimated index and correct it by a step or two, so
 * their cost does not depend on how far the anchor lies in the past.</p>
 */
public class RecurrenceExpander {

    private final CalendarConverter converter;
    private final BoundPolicy boundPolicy;
    private final ZoneId zone;

    public RecurrenceExpander(CalendarConverter converter, BoundPolicy boundPolicy) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.boundPolicy = Objects.requireNonNull(boundPolicy, "boundPolicy");
        this.zone = converter.zone();
    }

    public BoundPolicy boundPolicy() {
        return boundPolicy;
    }

    /**
     * Rejects rules the configured bound policy does not accept.
     */
    public void validate(RecurrenceRule rule) {
        Objects.requireNonNull(rule, "rule");
        if (boundPolicy == BoundPolicy.MUTUALLY_EXCLUSIVE
                && rule.isRecurring()
                && rule.endDate() != null
                && rule.count() != null) {
            throw new AmbiguousRecurrenceException(
                    "Recurrence may be bounded by an end date or by a count, not both");
        }
    }

    public OccurrenceSequence expand(OffsetDateTime anchor, RecurrenceRule rule) {
        Objects.requireNonNull(anchor, "anchor");
        validate(rule);
        return new OccurrenceSequence(this, anchor, rule, lastIndex(anchor, rule));
    }

    /**
     * Occurrence number {@code k} (0 is the anchor), ignoring the rule's bounds. Every occurrence,
     * the anchor included, carries the offset of the converter's zone.
     */
    public OffsetDateTime occurrence(OffsetDateTime anchor, RecurrenceRule rule, long k) {
        if (k < 0) {
            throw new IllegalArgumentException("Occurrence index must not be negative, got " + k);
        }
        ZonedDateTime base = anchor.atZoneSameInstant(zone);
        if (k == 0 || !rule.isRecurring()) {
            return base.toOffsetDateTime();
        }
        long steps = Math.multiplyExact(k, rule.interval());
        ZonedDateTime result = switch (rule.type()) {
            case DAILY -> base.plusDays(steps);
            case WEEKLY -> base.plusWeeks(steps);
            case MONTHLY -> rule.calendar() == RecurrenceCalendar.JALALI
                    ? plusJalaliMonths(base, steps)
                    : base.plusMonths(steps);
            case YEARLY -> rule.calendar() == RecurrenceCalendar.JALALI
                    ? plusJalaliMonths(base, Math.multiplyExact(steps, 12L))
                    : base.plusYears(steps);
            case NONE -> base;
        };
        return result.toOffsetDateTime();
    }

    public List<OffsetDateTime> nextOccurrences(RecurrenceRule rule,
                                                OffsetDateTime anchor,
                                                OffsetDateTime referenceTime,
                                                int n) {
        Objects.requireNonNull(referenceTime, "referenceTime");
        if (n < 0) {
            throw new IllegalArgumentException("Occurrence count must not be negative, got " + n);
        }
        if (n == 0) {
            return List.of();
        }
        OccurrenceSequence sequence = expand(anchor, rule);
        List<OffsetDateTime> result = new ArrayList<>(n);
        var iterator = sequence.iteratorAtOrAfter(referenceTime);
        while (result.size() < n && iterator.hasNext()) {
            result.add(iterator.next());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * First occurrence on a day of the period, in the converter's zone.
     */
    public Optional<OffsetDateTime> occurrenceWithin(RecurrenceRule rule, OffsetDateTime anchor, ResolvedPeriod period) {
        List<OffsetDateTime> within = collectWithin(rule, anchor, period, 1);
        return within.isEmpty() ? Optional.empty() : Optional.of(within.get(0));
    }

    public List<OffsetDateTime> occurrencesWithin(RecurrenceRule rule, OffsetDateTime anchor, ResolvedPeriod period) {
        return collectWithin(rule, anchor, period, Integer.MAX_VALUE);
    }

    private List<OffsetDateTime> collectWithin(RecurrenceRule rule,
                                               OffsetDateTime anchor,
                                               ResolvedPeriod period,
                                               int limit) {
        Objects.requireNonNull(period, "period");
        OccurrenceSequence sequence = expand(anchor, rule);
        OffsetDateTime from = period.startDate().atStartOfDay(zone).toOffsetDateTime();
        OffsetDateTime until = period.endDate().plusDays(1).atStartOfDay(zone).toOffsetDateTime();
        List<OffsetDateTime> result = new ArrayList<>();
        var iterator = sequence.iteratorAtOrAfter(from);
        while (result.size() < limit && iterator.hasNext()) {
            OffsetDateTime candidate = iterator.next();
            if (!candidate.isBefore(until)) {
                break;
            }
            result.add(candidate);
        }
        return Collections.unmodifiableList(result);
    }

    long lastIndex(OffsetDateTime anchor, RecurrenceRule rule) {
        if (!rule.isRecurring()) {
            return 0;
        }
        long last = OccurrenceSequence.UNBOUNDED;
        if (rule.count() != null) {
            last = rule.count() - 1L;
        }
        if (rule.endDate() != null) {
            last = Math.min(last, firstIndex(anchor, rule, rule.endDate(), false) - 1);
        }
        return last;
    }

    /**
     * Smallest index whose occurrence is at or after {@code time} ({@code inclusive}) or strictly
     * after it. Bounds are not applied.
     */
    long firstIndex(OffsetDateTime anchor, RecurrenceRule rule, OffsetDateTime time, boolean inclusive) {
        if (reaches(anchor, time, inclusive)) {
            return 0;
        }
        if (!rule.isRecurring()) {
            return 1;
        }
        long k = Math.max(0, estimateIndex(anchor, rule, time));
        while (k > 0 && reaches(occurrence(anchor, rule, k - 1), time, inclusive)) {
            k--;
        }
        while (!reaches(occurrence(anchor, rule, k), time, inclusive)) {
            k++;
        }
        return k;
    }

    private long estimateIndex(OffsetDateTime anchor, RecurrenceRule rule, OffsetDateTime time) {
        LocalDate from = anchor.atZoneSameInstant(zone).toLocalDate();
        LocalDate to = time.atZoneSameInstant(zone).toLocalDate();
        long units = switch (rule.type()) {
            case DAILY -> ChronoUnit.DAYS.between(from, to);
            case WEEKLY -> ChronoUnit.DAYS.between(from, to) / 7;
            case MONTHLY -> rule.calendar() == RecurrenceCalendar.JALALI
                    ? jalaliMonthIndex(to) - jalaliMonthIndex(from)
                    : ChronoUnit.MONTHS.between(from.withDayOfMonth(1), to.withDayOfMonth(1));
            case YEARLY -> rule.calendar() == RecurrenceCalendar.JALALI
                    ? converter.toJalali(to).year() - converter.toJalali(from).year()
                    : to.getYear() - from.getYear();
            case NONE -> 0;
        };
        return units / rule.interval();
    }

    private ZonedDateTime plusJalaliMonths(ZonedDateTime base, long months) {
        JalaliDate start = converter.toJalali(base.toLocalDate());
        long target = Math.addExact(jalaliMonthIndex(start), months);
        int year = Math.toIntExact(Math.floorDiv(target, 12L));
        int month = (int) Math.floorMod(target, 12L) + 1;
        int day = Math.min(start.day(), converter.daysInMonth(year, month));
        LocalDate date = converter.toGregorian(JalaliDate.of(year, month, day));
        return ZonedDateTime.of(date, base.toLocalTime(), zone);
    }

    private long jalaliMonthIndex(LocalDate date) {
        return jalaliMonthIndex(converter.toJalali(date));
    }

    private static long jalaliMonthIndex(JalaliDate date) {
        return date.year() * 12L + date.month() - 1;
    }

    private static boolean reaches(OffsetDateTime occurrence, OffsetDateTime time, boolean inclusive) {
        return inclusive ? !occurrence.isBefore(time) : occurrence.isAfter(time);
    }
}
