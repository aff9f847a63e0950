package com.wadechandler.notification.dispatch.schedule;

/**
 * Inclusive range of calendar values with a step, e.g. {@code 0-59/15}.
 * A single value is a range whose start and end are equal.
 */
public record CalendarRange(int start, int end, int step) {

    public static CalendarRange single(int value) {
        return new CalendarRange(value, value, 1);
    }

    /**
     * Schedulers commonly report an unset end as 0 and an unset step as 0; both mean "same as start" / "1".
     */
    public CalendarRange normalized() {
        return new CalendarRange(start, Math.max(start, end), Math.max(1, step));
    }
}
