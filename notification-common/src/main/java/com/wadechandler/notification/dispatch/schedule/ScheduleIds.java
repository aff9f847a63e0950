package com.wadechandler.notification.dispatch.schedule;

import java.util.Optional;
import java.util.UUID;

/**
 * Deterministic schedule ids for cron rules: {@code rule-{ruleId}-{enterpriseId}}.
 * A rule without an enterprise gets the literal {@code null} in place of the id.
 */
public final class ScheduleIds {

    public static final String PREFIX = "rule-";

    private ScheduleIds() {
        // static utility
    }

    public static String of(Long ruleId, UUID enterpriseId) {
        return PREFIX + ruleId + "-" + (enterpriseId == null ? "null" : enterpriseId.toString());
    }

    /**
     * Inverse of {@link #of}. Used to recognise rule-owned schedules whose memo is missing.
     */
    public static Optional<Key> parse(String scheduleId) {
        if (scheduleId == null || !scheduleId.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String rest = scheduleId.substring(PREFIX.length());
        int dash = rest.indexOf('-');
        if (dash <= 0 || dash == rest.length() - 1) {
            return Optional.empty();
        }
        String idPart = rest.substring(0, dash);
        if (!idPart.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        long ruleId;
        try {
            ruleId = Long.parseLong(idPart);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        String enterprisePart = rest.substring(dash + 1);
        if (enterprisePart.equals("null")) {
            return Optional.of(new Key(ruleId, null));
        }
        try {
            return Optional.of(new Key(ruleId, UUID.fromString(enterprisePart)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public record Key(Long ruleId, UUID enterpriseId) {
    }
}
