package tms.task_management_be.calendar;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Converts between the Jalali calendar and the Gregorian (ISO) calendar used for storage.
 *
 * <p>Conversion goes through a day count: {@link #fixedDay(int, int, int)} numbers Jalali days
 * from 1/1/1 and the count is aligned to the ISO epoch through the known correspondence
 * 1403/01/01 = 2024-03-20. The zone and clock are supplied at construction and only matter for
 * operations that start from an instant ({@link #toJalali(OffsetDateTime)}, {@link #today()}).</p>
 *
 * <p>Instances are immutable and safe for concurrent use.</p>
 */
public class CalendarConverter {

    private static final int CYCLE_YEARS = 33;
    private static final int LEAP_YEARS_PER_CYCLE = 8;
    private static final long DAYS_PER_CYCLE = CYCLE_YEARS * 365L + LEAP_YEARS_PER_CYCLE;
    private static final int[] LEAP_RESIDUES = {1, 5, 9, 13, 17, 22, 26, 30};

    private static final long NOWRUZ_1403_FIXED = fixedDay(1403, 1, 1);
    private static final long NOWRUZ_1403_EPOCH_DAY = LocalDate.of(2024, 3, 20).toEpochDay();

    public static final LocalDate MIN_SUPPORTED_DATE = gregorianOf(JalaliDate.MIN_YEAR, 1, 1);
    public static final LocalDate MAX_SUPPORTED_DATE =
            gregorianOf(JalaliDate.MAX_YEAR, 12, JalaliDate.lengthOfMonth(JalaliDate.MAX_YEAR, 12));

    private final ZoneId zone;
    private final Clock clock;

    public CalendarConverter(ZoneId zone, Clock clock) {
        this.zone = Objects.requireNonNull(zone, "zone");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ZoneId zone() {
        return zone;
    }

    public LocalDate toGregorian(JalaliDate date) {
        Objects.requireNonNull(date, "date");
        return gregorianOf(date.year(), date.month(), date.day());
    }

    public LocalDate toGregorian(int year, int month, int day) {
        return toGregorian(JalaliDate.of(year, month, day));
    }

    public JalaliDate toJalali(LocalDate date) {
        Objects.requireNonNull(date, "date");
        if (date.isBefore(MIN_SUPPORTED_DATE) || date.isAfter(MAX_SUPPORTED_DATE)) {
            throw new InvalidDateException("Gregorian date " + date + " is outside the supported range "
                    + MIN_SUPPORTED_DATE + " .. " + MAX_SUPPORTED_DATE);
        }
        long fixed = date.toEpochDay() - NOWRUZ_1403_EPOCH_DAY + NOWRUZ_1403_FIXED;
        int estimate = (int) Math.floorDiv((fixed - 1) * CYCLE_YEARS, DAYS_PER_CYCLE) + 1;
        int year = Math.max(JalaliDate.MIN_YEAR, Math.min(JalaliDate.MAX_YEAR, estimate));
        while (year > JalaliDate.MIN_YEAR && fixedDay(year, 1, 1) > fixed) {
            year--;
        }
        while (year < JalaliDate.MAX_YEAR && fixedDay(year + 1, 1, 1) <= fixed) {
            year++;
        }
        int dayOfYear = (int) (fixed - fixedDay(year, 1, 1)) + 1;
        int month;
        int day;
        if (dayOfYear <= 186) {
            month = (dayOfYear - 1) / 31 + 1;
            day = (dayOfYear - 1) % 31 + 1;
        } else {
            month = (dayOfYear - 187) / 30 + 7;
            day = (dayOfYear - 187) % 30 + 1;
        }
        return JalaliDate.of(year, month, day);
    }

    /**
     * Converts the civil date of an instant as seen in the configured zone.
     */
    public JalaliDate toJalali(OffsetDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime");
        return toJalali(dateTime.atZoneSameInstant(zone).toLocalDate());
    }

    public JalaliDate today() {
        return toJalali(LocalDate.now(clock.withZone(zone)));
    }

    public boolean isLeapYear(int jalaliYear) {
        return JalaliDate.isLeapYear(jalaliYear);
    }

    public int daysInMonth(int jalaliYear, int jalaliMonth) {
        return JalaliDate.lengthOfMonth(jalaliYear, jalaliMonth);
    }

    public int daysInYear(int jalaliYear) {
        return JalaliDate.lengthOfYear(jalaliYear);
    }

    /**
     * First Saturday on or after Farvardin 1 of the given year; the day week 1 starts.
     */
    public LocalDate firstSaturday(int jalaliYear) {
        LocalDate nowruz = toGregorian(jalaliYear, 1, 1);
        return nowruz.with(TemporalAdjusters.nextOrSame(DayOfWeek.SATURDAY));
    }

    /**
     * Saturday-based week number within the Jalali year. Days before the first Saturday are week 0.
     */
    public int weekOfYear(JalaliDate date) {
        LocalDate gregorian = toGregorian(date);
        LocalDate firstSaturday = firstSaturday(date.year());
        if (gregorian.isBefore(firstSaturday)) {
            return 0;
        }
        return (int) (ChronoUnit.DAYS.between(firstSaturday, gregorian) / 7) + 1;
    }

    /**
     * Highest week number reached by any day of the year (the week of Esfand's last day).
     */
    public int weeksInYear(int jalaliYear) {
        return weekOfYear(JalaliDate.of(jalaliYear, 12, daysInMonth(jalaliYear, 12)));
    }

    static long fixedDay(int year, int month, int day) {
        return 365L * (year - 1) + leapYearsThrough(year - 1) + JalaliDate.of(year, month, day).dayOfYear();
    }

    private static long leapYearsThrough(int year) {
        long cycles = Math.floorDiv(year, CYCLE_YEARS);
        int remainder = Math.floorMod(year, CYCLE_YEARS);
        long count = cycles * LEAP_YEARS_PER_CYCLE;
        for (int residue : LEAP_RESIDUES) {
            if (residue <= remainder) {
                count++;
            }
        }
        return count;
    }

    private static LocalDate gregorianOf(int year, int month, int day) {
        return LocalDate.ofEpochDay(fixedDay(year, month, day) - NOWRUZ_1403_FIXED + NOWRUZ_1403_EPOCH_DAY);
    }
}
