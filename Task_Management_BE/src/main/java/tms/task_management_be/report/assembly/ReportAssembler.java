package tms.task_management_be.report.assembly;

import tms.task_management_be.period.ResolvedPeriod;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds the content of a report for one scope and period. Implementations read current data; the
 * result is either shown as a live report or frozen into a snapshot.
 */
public interface ReportAssembler {

    JsonNode assembleIndividual(long userId, ResolvedPeriod period);

    JsonNode assembleTeam(long domainId, ResolvedPeriod period);
}
