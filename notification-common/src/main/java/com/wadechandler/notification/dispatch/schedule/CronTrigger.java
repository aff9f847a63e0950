package com.wadechandler.notification.dispatch.schedule;

import com.wadechandler.notification.dispatch.exception.InvalidTriggerConfigException;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

/**
 * The {@code {cron, timezone}} pair stored in a cron rule's trigger config.
 */
public record CronTrigger(String cron, String timezone) {

    public static final String DEFAULT_TIMEZONE = "UTC";

    public static CronTrigger from(Map<String, Object> triggerConfig) {
        if (triggerConfig == null) {
            throw new InvalidTriggerConfigException("Cron rule has no trigger config");
        }
        Object cron = triggerConfig.get("cron");
        if (!(cron instanceof String cronText) || cronText.isBlank()) {
            throw new InvalidTriggerConfigException("Trigger config has no cron expression: " + triggerConfig);
        }
        Object timezone = triggerConfig.get("timezone");
        String zone = DEFAULT_TIMEZONE;
        if (timezone != null) {
            if (!(timezone instanceof String zoneText)) {
                throw new InvalidTriggerConfigException("Trigger config timezone is not a string: " + timezone);
            }
            if (!zoneText.isBlank()) {
                zone = zoneText.trim();
            }
        }
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new InvalidTriggerConfigException("Unknown time zone '" + zone + "'", e);
        }
        return new CronTrigger(cronText.trim(), zone);
    }

    public CronCalendar calendar() {
        return CronCalendarTranslator.translate(cron);
    }
}
