package tms.task_management_be.meeting;

import tms.task_management_be.meeting.recurrence.RecurrenceExpander;
import tms.task_management_be.period.PeriodDescriptor;
import tms.task_management_be.period.PeriodResolver;
import tms.task_management_be.period.ResolvedPeriod;
import tms.task_management_be.web.ApiException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class MeetingService {

    static final int DEFAULT_OCCURRENCE_COUNT = 3;
    static final int MAX_OCCURRENCE_COUNT = 50;

    private final MeetingRepository repository;
    private final RecurrenceExpander expander;
    private final PeriodResolver periodResolver;
    private final Clock clock;

    public MeetingService(MeetingRepository repository,
                          RecurrenceExpander expander,
                          PeriodResolver periodResolver,
                          Clock clock) {
        this.repository = repository;
        this.expander = expander;
        this.periodResolver = periodResolver;
        this.clock = clock;
    }

    /**
     * Next occurrences of a stored meeting at or after {@code from} (now when absent).
     */
    public NextOccurrences nextOccurrences(long meetingId, Integer count, OffsetDateTime from) {
        int n = count == null ? DEFAULT_OCCURRENCE_COUNT : count;
        if (n < 1 || n > MAX_OCCURRENCE_COUNT) {
            throw ApiException.validation(
                    "Count must be between 1 and " + MAX_OCCURRENCE_COUNT + ".", "occurrence_count_invalid");
        }
        MeetingEntity meeting = requireMeeting(meetingId);
        OffsetDateTime reference = from != null ? from : OffsetDateTime.now(clock);
        List<OffsetDateTime> occurrences =
                expander.nextOccurrences(meeting.recurrence(), meeting.startsAt(), reference, n);
        return new NextOccurrences(meeting, reference, occurrences);
    }

    public OccurrenceInPeriod occurrenceWithin(long meetingId, PeriodDescriptor descriptor) {
        MeetingEntity meeting = requireMeeting(meetingId);
        ResolvedPeriod period = periodResolver.resolve(descriptor);
        Optional<OffsetDateTime> occurrence =
                expander.occurrenceWithin(meeting.recurrence(), meeting.startsAt(), period);
        return new OccurrenceInPeriod(meeting, period, occurrence.orElse(null));
    }

    private MeetingEntity requireMeeting(long meetingId) {
        return repository.findById(meetingId)
                .orElseThrow(() -> ApiException.notFound("Meeting was not found.", "meeting"));
    }

    public record NextOccurrences(MeetingEntity meeting, OffsetDateTime reference, List<OffsetDateTime> occurrences) {
    }

    public record OccurrenceInPeriod(MeetingEntity meeting, ResolvedPeriod period, OffsetDateTime occurrence) {
    }
}
