package tms.task_management_be.meeting;

import tms.task_management_be.meeting.recurrence.RecurrenceRule;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Immutable projection of the <code>meeting</code> table. {@code startsAt} is the recurrence anchor.
 */
public record MeetingEntity(
        long id,
        String topic,
        MeetingType type,
        String location,
        OffsetDateTime startsAt,
        RecurrenceRule recurrence,
        Long domainId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    public MeetingEntity {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(startsAt, "startsAt");
        Objects.requireNonNull(recurrence, "recurrence");
    }
}
