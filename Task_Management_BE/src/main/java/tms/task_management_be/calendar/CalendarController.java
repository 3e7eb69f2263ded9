package tms.task_management_be.calendar;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/calendar")
@Tag(name = "Calendar", description = "Jalali and Gregorian date conversion")
public class CalendarController {
    private final CalendarConverter converter;
    private final CalendarProperties properties;

    public CalendarController(CalendarConverter converter, CalendarProperties properties) {
        this.converter = converter;
        this.properties = properties;
    }

    public record CalendarDateResponse(int jalaliYear,
                                       int jalaliMonth,
                                       int jalaliDay,
                                       String monthName,
                                       int week,
                                       boolean leapYear,
                                       LocalDate gregorianDate) {}

    @GetMapping("/to-gregorian")
    @Operation(summary = "Jalali to Gregorian", description = "Converts a Jalali date to its ISO calendar date.")
    public CalendarDateResponse toGregorian(
            @Parameter(description = "Jalali year", required = true) @RequestParam int year,
            @Parameter(description = "Jalali month (1-12)", required = true) @RequestParam int month,
            @Parameter(description = "Jalali day", required = true) @RequestParam int day) {
        return describe(JalaliDate.of(year, month, day));
    }

    @GetMapping("/to-jalali")
    @Operation(summary = "Gregorian to Jalali", description = "Converts an ISO calendar date to the Jalali calendar.")
    public CalendarDateResponse toJalali(
            @Parameter(description = "ISO date", required = true)
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return describe(converter.toJalali(date));
    }

    @GetMapping("/today")
    @Operation(summary = "Today", description = "Returns the current date in both calendars.")
    public CalendarDateResponse today() {
        return describe(converter.today());
    }

    private CalendarDateResponse describe(JalaliDate date) {
        return new CalendarDateResponse(
                date.year(),
                date.month(),
                date.day(),
                date.monthName().displayName(properties.getLabelLanguage()),
                converter.weekOfYear(date),
                date.isLeapYear(),
                converter.toGregorian(date));
    }
}
