package tms.task_management_be.report.assembly;

import tms.task_management_be.calendar.CalendarConverter;
import tms.task_management_be.meeting.MeetingEntity;
import tms.task_management_be.meeting.MeetingRepository;
import tms.task_management_be.meeting.recurrence.AmbiguousRecurrenceException;
import tms.task_management_be.meeting.recurrence.RecurrenceExpander;
import tms.task_management_be.period.PeriodDescriptor;
import tms.task_management_be.period.ResolvedPeriod;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;

/**
 * Assembles the period header and the meeting section of a report. Recurring meetings are
 * attributed to the period by expanding their rule over its days.
 */
@Component
public class MeetingReportAssembler implements ReportAssembler {
    private static final Logger log = LoggerFactory.getLogger(MeetingReportAssembler.class);

    private final MeetingRepository meetingRepository;
    private final RecurrenceExpander expander;
    private final ObjectMapper objectMapper;
    private final ZoneId zone;
    private final Clock clock;

    public MeetingReportAssembler(MeetingRepository meetingRepository,
                                  RecurrenceExpander expander,
                                  CalendarConverter converter,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.meetingRepository = meetingRepository;
        this.expander = expander;
        this.objectMapper = objectMapper;
        this.zone = converter.zone();
        this.clock = clock;
    }

    @Override
    public JsonNode assembleIndividual(long userId, ResolvedPeriod period) {
        ObjectNode root = header("individual", period);
        root.put("userId", userId);
        List<MeetingEntity> candidates =
                meetingRepository.findCandidatesForParticipant(userId, windowStart(period), windowEnd(period));
        root.set("meetings", meetings(candidates, period));
        return root;
    }

    @Override
    public JsonNode assembleTeam(long domainId, ResolvedPeriod period) {
        ObjectNode root = header("team", period);
        root.put("domainId", domainId);
        List<MeetingEntity> candidates =
                meetingRepository.findCandidatesForDomain(domainId, windowStart(period), windowEnd(period));
        root.set("meetings", meetings(candidates, period));
        return root;
    }

    private ObjectNode header(String reportType, ResolvedPeriod period) {
        PeriodDescriptor descriptor = period.descriptor();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("reportType", reportType);
        ObjectNode node = root.putObject("period");
        node.put("type", descriptor.type().wireName());
        node.put("jalaliYear", descriptor.jalaliYear());
        // only the fields the type reads; stray request values must not reach stored content
        switch (descriptor.type()) {
            case DAILY -> {
                node.put("jalaliMonth", descriptor.jalaliMonth());
                node.put("jalaliDay", descriptor.jalaliDay());
            }
            case WEEKLY -> node.put("jalaliWeek", descriptor.jalaliWeek());
            case MONTHLY -> node.put("jalaliMonth", descriptor.jalaliMonth());
            case YEARLY -> {
            }
        }
        node.put("startDate", period.startDate().toString());
        node.put("endDate", period.endDate().toString());
        node.put("label", period.label());
        root.put("generatedAt", OffsetDateTime.now(clock).toString());
        return root;
    }

    private ArrayNode meetings(List<MeetingEntity> candidates, ResolvedPeriod period) {
        ArrayNode array = objectMapper.createArrayNode();
        for (MeetingEntity meeting : candidates) {
            List<OffsetDateTime> occurrences;
            try {
                occurrences = expander.occurrencesWithin(meeting.recurrence(), meeting.startsAt(), period);
            } catch (AmbiguousRecurrenceException ex) {
                log.warn("Meeting {} skipped in report for {}: {}", meeting.id(), period.label(), ex.getMessage());
                continue;
            }
            if (occurrences.isEmpty()) {
                continue;
            }
            ObjectNode node = array.addObject();
            node.put("id", meeting.id());
            node.put("topic", meeting.topic());
            node.put("type", meeting.type().name().toLowerCase(Locale.ROOT));
            node.put("location", meeting.location());
            node.put("recurrence", meeting.recurrence().type().name().toLowerCase(Locale.ROOT));
            ArrayNode times = node.putArray("occurrences");
            occurrences.forEach(time -> times.add(time.toString()));
        }
        return array;
    }

    private OffsetDateTime windowStart(ResolvedPeriod period) {
        return period.startDate().atStartOfDay(zone).toOffsetDateTime();
    }

    private OffsetDateTime windowEnd(ResolvedPeriod period) {
        return period.endDate().plusDays(1).atStartOfDay(zone).toOffsetDateTime();
    }
}
