package net.dbbeat.core.model;

public record CrontabSchedule(
        Long id,
        String minute,
        String hour,
        String dayOfMonth,
        String monthOfYear,
        String dayOfWeek,
        String timezone
) {
    public static final String ANY = "*";

    public CrontabSchedule {
        minute = orAny(minute);
        hour = orAny(hour);
        dayOfMonth = orAny(dayOfMonth);
        monthOfYear = orAny(monthOfYear);
        dayOfWeek = orAny(dayOfWeek);
    }

    public static CrontabSchedule ofNew(String minute, String hour, String dayOfMonth,
                                        String monthOfYear, String dayOfWeek, String timezone) {
        return new CrontabSchedule(null, minute, hour, dayOfMonth, monthOfYear, dayOfWeek, timezone);
    }

    /** UNIX 5-field order: minute hour day-of-month month day-of-week */
    public String toCronExpression() {
        return minute + " " + hour + " " + dayOfMonth + " " + monthOfYear + " " + dayOfWeek;
    }

    private static String orAny(String field) {
        return field == null || field.isBlank() ? ANY : field.trim();
    }

    @Override
    public String toString() {
        return toCronExpression() + " (" + timezone + ")";
    }
}
