package tms.task_management_be.calendar;

/**
 * Immutable Jalali (solar Hijri) civil date.
 *
 * <p>Months 1–6 have 31 days, months 7–11 have 30 and Esfand (12) has 29, or 30 in a leap year.
 * Leap years follow the 33-year arithmetic cycle: a year is leap when {@code year mod 33} is one of
 * 1, 5, 9, 13, 17, 22, 26 or 30. Every instance is valid for its year; an invalid combination
 * fails with {@link InvalidDateException}.</p>
 */
public record JalaliDate(int year, int month, int day) implements Comparable<JalaliDate> {

    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 3000;

    public JalaliDate {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new InvalidDateException(
                    "Jalali year must be between " + MIN_YEAR + " and " + MAX_YEAR + ", got " + year);
        }
        if (month < 1 || month > 12) {
            throw new InvalidDateException("Jalali month must be between 1 and 12, got " + month);
        }
        int length = lengthOfMonth(year, month);
        if (day < 1 || day > length) {
            throw new InvalidDateException(
                    "Invalid Jalali date " + year + "/" + month + "/" + day + ": month has " + length + " days");
        }
    }

    public static JalaliDate of(int year, int month, int day) {
        return new JalaliDate(year, month, day);
    }

    public static boolean isLeapYear(int year) {
        return switch (Math.floorMod(year, 33)) {
            case 1, 5, 9, 13, 17, 22, 26, 30 -> true;
            default -> false;
        };
    }

    public static int lengthOfMonth(int year, int month) {
        if (month < 1 || month > 12) {
            throw new InvalidDateException("Jalali month must be between 1 and 12, got " + month);
        }
        if (month <= 6) {
            return 31;
        }
        if (month <= 11) {
            return 30;
        }
        return isLeapYear(year) ? 30 : 29;
    }

    public static int lengthOfYear(int year) {
        return isLeapYear(year) ? 366 : 365;
    }

    /**
     * 1-based position of this date within its year.
     */
    public int dayOfYear() {
        return month <= 7 ? (month - 1) * 31 + day : 186 + (month - 7) * 30 + day;
    }

    public boolean isLeapYear() {
        return isLeapYear(year);
    }

    public int lengthOfMonth() {
        return lengthOfMonth(year, month);
    }

    public JalaliMonth monthName() {
        return JalaliMonth.of(month);
    }

    @Override
    public int compareTo(JalaliDate other) {
        if (year != other.year) {
            return Integer.compare(year, other.year);
        }
        if (month != other.month) {
            return Integer.compare(month, other.month);
        }
        return Integer.compare(day, other.day);
    }

    @Override
    public String toString() {
        return String.format("%04d/%02d/%02d", year, month, day);
    }
}
