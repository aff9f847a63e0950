package com.wadechandler.notification.dispatch.rule;

import com.wadechandler.notification.dispatch.exception.NoRecipientsException;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Pulls the recipient list out of a rule payload. {@code recipients} (a list) wins over
 * {@code recipient} (a single subscriber id); blank entries are dropped.
 */
public final class RecipientExtractor {

    private RecipientExtractor() {
        // static utility
    }

    public static List<String> extract(Map<String, Object> rulePayload) {
        if (rulePayload != null) {
            if (rulePayload.get("recipients") instanceof Collection<?> recipients) {
                List<String> list = recipients.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .map(String::trim)
                        .filter(r -> !r.isEmpty())
                        .distinct()
                        .toList();
                if (!list.isEmpty()) {
                    return list;
                }
            }
            if (rulePayload.get("recipient") instanceof String recipient && !recipient.isBlank()) {
                return List.of(recipient.trim());
            }
        }
        throw new NoRecipientsException("Rule payload has neither 'recipients' nor 'recipient'");
    }
}
