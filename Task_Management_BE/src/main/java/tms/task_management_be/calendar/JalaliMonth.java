package tms.task_management_be.calendar;

/**
 * The twelve Jalali months in calendar order.
 */
public enum JalaliMonth {
    FARVARDIN("فروردین", "Farvardin"),
    ORDIBEHESHT("اردیبهشت", "Ordibehesht"),
    KHORDAD("خرداد", "Khordad"),
    TIR("تیر", "Tir"),
    MORDAD("مرداد", "Mordad"),
    SHAHRIVAR("شهریور", "Shahrivar"),
    MEHR("مهر", "Mehr"),
    ABAN("آبان", "Aban"),
    AZAR("آذر", "Azar"),
    DEY("دی", "Dey"),
    BAHMAN("بهمن", "Bahman"),
    ESFAND("اسفند", "Esfand");

    private final String persianName;
    private final String latinName;

    JalaliMonth(String persianName, String latinName) {
        this.persianName = persianName;
        this.latinName = latinName;
    }

    public static JalaliMonth of(int month) {
        if (month < 1 || month > 12) {
            throw new InvalidDateException("Jalali month must be between 1 and 12, got " + month);
        }
        return values()[month - 1];
    }

    public int number() {
        return ordinal() + 1;
    }

    public String displayName(LabelLanguage language) {
        return language == LabelLanguage.EN ? latinName : persianName;
    }
}
