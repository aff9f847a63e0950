package com.wadechandler.notification.dispatch.schedule;

import java.util.List;

/**
 * Structured form of a five-field cron expression. Months are 1-12, days of week 0-6 with 0 = Sunday.
 */
public record CronCalendar(
        List<CalendarRange> minutes,
        List<CalendarRange> hours,
        List<CalendarRange> daysOfMonth,
        List<CalendarRange> months,
        List<CalendarRange> daysOfWeek
) {

    public CronCalendar {
        minutes = List.copyOf(minutes);
        hours = List.copyOf(hours);
        daysOfMonth = List.copyOf(daysOfMonth);
        months = List.copyOf(months);
        daysOfWeek = List.copyOf(daysOfWeek);
    }

    public CronCalendar normalized() {
        return new CronCalendar(
                normalize(minutes), normalize(hours), normalize(daysOfMonth), normalize(months), normalize(daysOfWeek));
    }

    /**
     * Equality after normalization, so that a calendar read back from a scheduler
     * compares equal to the one that was written.
     */
    public boolean sameAs(CronCalendar other) {
        return other != null && normalized().equals(other.normalized());
    }

    private static List<CalendarRange> normalize(List<CalendarRange> ranges) {
        return ranges.stream().map(CalendarRange::normalized).toList();
    }
}
