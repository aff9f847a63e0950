package com.wadechandler.notification.dispatch.schedule;

import com.wadechandler.notification.dispatch.exception.InvalidTriggerConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates standard five-field cron expressions ({@code minute hour day-of-month month day-of-week})
 * into a {@link CronCalendar}. Supports {@code *}, lists, ranges, steps, month names
 * ({@code JAN}-{@code DEC}) and weekday names ({@code SUN}-{@code SAT}); {@code 7} is Sunday.
 */
public final class CronCalendarTranslator {

    private static final Map<String, Integer> MONTH_NAMES = Map.ofEntries(
            Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("APR", 4),
            Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AUG", 8),
            Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12));

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6);

    private enum Field {
        MINUTE("minute", 0, 59, Map.of()),
        HOUR("hour", 0, 23, Map.of()),
        DAY_OF_MONTH("day-of-month", 1, 31, Map.of()),
        MONTH("month", 1, 12, MONTH_NAMES),
        DAY_OF_WEEK("day-of-week", 0, 7, DAY_NAMES);

        private final String label;
        private final int min;
        private final int max;
        private final Map<String, Integer> names;

        Field(String label, int min, int max, Map<String, Integer> names) {
            this.label = label;
            this.min = min;
            this.max = max;
            this.names = names;
        }
    }

    private CronCalendarTranslator() {
        // static utility
    }

    public static CronCalendar translate(String cron) {
        if (cron == null || cron.isBlank()) {
            throw new InvalidTriggerConfigException("Cron expression is empty");
        }
        String[] fields = cron.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidTriggerConfigException(
                    "Cron expression '" + cron + "' must have 5 fields but has " + fields.length);
        }
        return new CronCalendar(
                parseField(cron, fields[0], Field.MINUTE),
                parseField(cron, fields[1], Field.HOUR),
                parseField(cron, fields[2], Field.DAY_OF_MONTH),
                parseField(cron, fields[3], Field.MONTH),
                foldSunday(parseField(cron, fields[4], Field.DAY_OF_WEEK)));
    }

    private static List<CalendarRange> parseField(String cron, String text, Field field) {
        List<CalendarRange> ranges = new ArrayList<>();
        for (String part : text.split(",", -1)) {
            ranges.add(parsePart(cron, part, field));
        }
        return ranges;
    }

    private static CalendarRange parsePart(String cron, String part, Field field) {
        if (part.isEmpty()) {
            throw invalid(cron, field, "empty list element");
        }
        String base = part;
        int step = 1;
        boolean stepped = false;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            base = part.substring(0, slash);
            step = parseNumber(cron, part.substring(slash + 1), field);
            stepped = true;
            if (step <= 0) {
                throw invalid(cron, field, "step must be positive");
            }
        }

        int start;
        int end;
        if (base.equals("*")) {
            start = field.min;
            end = field == Field.DAY_OF_WEEK ? 6 : field.max;
        } else if (base.indexOf('-') > 0) {
            String[] bounds = base.split("-", 2);
            start = parseValue(cron, bounds[0], field);
            end = parseValue(cron, bounds[1], field);
            if (start > end) {
                throw invalid(cron, field, "range " + base + " runs backwards");
            }
        } else {
            start = parseValue(cron, base, field);
            end = stepped ? field.max : start;
        }
        return new CalendarRange(start, end, step);
    }

    private static int parseValue(String cron, String token, Field field) {
        Integer named = field.names.get(token.toUpperCase(Locale.ROOT));
        int value = named != null ? named : parseNumber(cron, token, field);
        if (value < field.min || value > field.max) {
            throw invalid(cron, field, "value " + token + " outside " + field.min + "-" + field.max);
        }
        return value;
    }

    private static int parseNumber(String cron, String token, Field field) {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            throw invalid(cron, field, "'" + token + "' is not a number");
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw invalid(cron, field, "'" + token + "' is not a number");
        }
    }

    /**
     * Day-of-week 7 is an alias for Sunday; the structured calendar only knows 0-6.
     */
    private static List<CalendarRange> foldSunday(List<CalendarRange> ranges) {
        List<CalendarRange> folded = new ArrayList<>();
        for (CalendarRange range : ranges) {
            if (range.end() < 7) {
                folded.add(range);
                continue;
            }
            if (range.start() == 7) {
                folded.add(CalendarRange.single(0));
                continue;
            }
            folded.add(new CalendarRange(range.start(), 6, range.step()));
            if ((7 - range.start()) % range.step() == 0) {
                folded.add(CalendarRange.single(0));
            }
        }
        return folded;
    }

    private static InvalidTriggerConfigException invalid(String cron, Field field, String reason) {
        return new InvalidTriggerConfigException(
                "Invalid " + field.label + " field in cron expression '" + cron + "': " + reason);
    }
}
