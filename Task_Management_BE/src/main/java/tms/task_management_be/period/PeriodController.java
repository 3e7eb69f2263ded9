package tms.task_management_be.period;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/periods")
@Tag(name = "Periods", description = "Resolution of Jalali reporting periods to Gregorian date ranges")
public class PeriodController {
    private final PeriodResolver resolver;

    public PeriodController(PeriodResolver resolver) {
        this.resolver = resolver;
    }

    @GetMapping("/resolve")
    @Operation(summary = "Resolve period", description = "Returns the inclusive ISO date range and label of a Jalali period.")
    public PeriodResponse resolve(
            @Parameter(description = "daily, weekly, monthly or yearly", required = true) @RequestParam String type,
            @Parameter(description = "Jalali year", required = true) @RequestParam int year,
            @Parameter(description = "Jalali month (daily, monthly)") @RequestParam(required = false) Integer month,
            @Parameter(description = "Jalali week number (weekly)") @RequestParam(required = false) Integer week,
            @Parameter(description = "Jalali day (daily)") @RequestParam(required = false) Integer day) {
        PeriodDescriptor descriptor = new PeriodDescriptor(PeriodType.parse(type), year, month, week, day);
        return PeriodResponse.from(resolver.resolve(descriptor));
    }

    @GetMapping("/reselect")
    @Operation(summary = "Change year or month",
            description = "Moves a selected daily or monthly period to another year/month, clamping the day to the target month.")
    public PeriodResponse reselect(
            @RequestParam String type,
            @RequestParam int year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) Integer day,
            @Parameter(description = "Target Jalali year", required = true) @RequestParam int targetYear,
            @Parameter(description = "Target Jalali month") @RequestParam(required = false) Integer targetMonth) {
        PeriodDescriptor previous = new PeriodDescriptor(PeriodType.parse(type), year, month, null, day);
        return PeriodResponse.from(resolver.resolveReselected(previous, targetYear, targetMonth));
    }

    @GetMapping("/current")
    @Operation(summary = "Current period", description = "Returns the period of the given type that contains today.")
    public PeriodResponse current(@RequestParam String type) {
        return PeriodResponse.from(resolver.resolve(resolver.current(PeriodType.parse(type))));
    }
}
