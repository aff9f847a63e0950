package com.wadechandler.notification.dispatch.reconcile;

import com.wadechandler.notification.dispatch.model.NotificationRule;
import com.wadechandler.notification.dispatch.model.dto.ReconciliationStats;
import com.wadechandler.notification.dispatch.model.dto.SyncStats;
import com.wadechandler.notification.dispatch.repository.NotificationRuleRepository;
import com.wadechandler.notification.dispatch.schedule.ScheduleBackend;
import com.wadechandler.notification.dispatch.schedule.ScheduleDefinition;
import com.wadechandler.notification.dispatch.schedule.ScheduleIds;
import com.wadechandler.notification.dispatch.schedule.ScheduleSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps the scheduling backend in step with the rule table: every active cron rule has exactly
 * one schedule that matches its cron, time zone and paused state, and no rule-owned schedule
 * outlives its rule.
 */
@Service
@Profile("reconciler")
@RequiredArgsConstructor
@Slf4j
public class RuleSyncService {

    private final NotificationRuleRepository ruleRepository;
    private final ScheduleBackend scheduleBackend;

    /**
     * Bring one rule's schedule in line with the rule.
     *
     * @throws com.wadechandler.notification.dispatch.exception.InvalidTriggerConfigException if an active cron
     *         rule has no usable cron expression
     * @throws com.wadechandler.notification.dispatch.exception.ScheduleBackendException if the backend fails
     */
    public SyncAction syncRule(NotificationRule rule) {
        String scheduleId = ScheduleIds.of(rule.getId(), rule.getEnterpriseId());

        if (!rule.isActiveCron()) {
            boolean deleted = scheduleBackend.deleteSchedule(scheduleId);
            log.debug("Rule {} is not an active cron rule, schedule {} {}",
                    rule.getId(), scheduleId, deleted ? "deleted" : "absent");
            return deleted ? SyncAction.DELETED : SyncAction.ABSENT;
        }

        ScheduleDefinition definition = ScheduleDefinition.forRule(rule);
        Optional<ScheduleSnapshot> existing = scheduleBackend.getSchedule(scheduleId);
        if (existing.isEmpty()) {
            scheduleBackend.createSchedule(definition);
            return SyncAction.CREATED;
        }
        if (definition.matches(existing.get())) {
            return SyncAction.UNCHANGED;
        }
        scheduleBackend.updateSchedule(definition);
        return SyncAction.UPDATED;
    }

    /**
     * Sync every active cron rule, optionally of one enterprise. Inactive rules are not visited,
     * so leftover schedules are only cleaned up by {@link #reconcileSchedules(UUID)}.
     */
    public SyncStats syncAllRules(UUID enterpriseId) {
        return syncRules(ruleRepository.findActiveCronRules(enterpriseId));
    }

    /**
     * Sync each rule independently; one rule's failure is counted and does not stop the others.
     */
    public SyncStats syncRules(List<NotificationRule> rules) {
        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int deleted = 0;
        int errors = 0;
        for (NotificationRule rule : rules) {
            try {
                switch (syncRule(rule)) {
                    case CREATED -> created++;
                    case UPDATED -> updated++;
                    case UNCHANGED -> unchanged++;
                    case DELETED -> deleted++;
                    case ABSENT -> { }
                }
            } catch (RuntimeException e) {
                errors++;
                log.warn("Failed to sync rule {}: {}", rule.getId(), e.getMessage(), e);
            }
        }
        SyncStats stats = new SyncStats(rules.size(), created, updated, unchanged, deleted, errors);
        if (!rules.isEmpty()) {
            log.info("Synced {} rule(s): {}", rules.size(), stats);
        }
        return stats;
    }

    /**
     * Full diff between active cron rules and the schedules that exist. Creates what is missing,
     * updates what drifted, and deletes rule-owned schedules that no active rule accounts for.
     * Schedules not owned by rules are left alone.
     *
     * @throws com.wadechandler.notification.dispatch.exception.ScheduleBackendException if the
     *         schedules cannot be listed at all
     */
    public ReconciliationStats reconcileSchedules(UUID enterpriseId) {
        List<NotificationRule> activeRules = ruleRepository.findActiveCronRules(enterpriseId);
        List<ScheduleSnapshot> listed = scheduleBackend.listSchedules(enterpriseId);

        Set<String> existingIds = new HashSet<>();
        listed.forEach(snapshot -> existingIds.add(snapshot.scheduleId()));
        Set<String> expectedIds = new HashSet<>();

        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int deleted = 0;
        int errors = 0;

        for (NotificationRule rule : activeRules) {
            String scheduleId = ScheduleIds.of(rule.getId(), rule.getEnterpriseId());
            expectedIds.add(scheduleId);
            try {
                ScheduleDefinition definition = ScheduleDefinition.forRule(rule);
                Optional<ScheduleSnapshot> existing = existingIds.contains(scheduleId)
                        ? scheduleBackend.getSchedule(scheduleId)
                        : Optional.empty();
                if (existing.isEmpty()) {
                    scheduleBackend.createSchedule(definition);
                    created++;
                } else if (definition.matches(existing.get())) {
                    unchanged++;
                } else {
                    scheduleBackend.updateSchedule(definition);
                    updated++;
                }
            } catch (RuntimeException e) {
                errors++;
                log.warn("Failed to reconcile rule {}: {}", rule.getId(), e.getMessage(), e);
            }
        }

        for (ScheduleSnapshot snapshot : listed) {
            if (expectedIds.contains(snapshot.scheduleId()) || !snapshot.isRuleOwned()) {
                continue;
            }
            try {
                if (scheduleBackend.deleteSchedule(snapshot.scheduleId())) {
                    deleted++;
                    log.info("Deleted orphan schedule {} (rule {})", snapshot.scheduleId(), snapshot.ruleId());
                }
            } catch (RuntimeException e) {
                errors++;
                log.warn("Failed to delete orphan schedule {}: {}", snapshot.scheduleId(), e.getMessage(), e);
            }
        }

        ReconciliationStats stats = new ReconciliationStats(created, updated, unchanged, deleted, errors);
        log.info("Reconciled {} active rule(s) against {} schedule(s): {}", activeRules.size(), listed.size(), stats);
        return stats;
    }

    /**
     * Delete a rule's schedule by identity, for rules that no longer exist in the table.
     */
    public boolean removeSchedule(Long ruleId, UUID enterpriseId) {
        return scheduleBackend.deleteSchedule(ScheduleIds.of(ruleId, enterpriseId));
    }
}
