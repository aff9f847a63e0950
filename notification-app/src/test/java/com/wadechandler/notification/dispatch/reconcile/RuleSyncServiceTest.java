package com.wadechandler.notification.dispatch.reconcile;

import com.wadechandler.notification.dispatch.model.NotificationRule;
import com.wadechandler.notification.dispatch.model.PublishStatus;
import com.wadechandler.notification.dispatch.model.TriggerType;
import com.wadechandler.notification.dispatch.model.dto.ReconciliationStats;
import com.wadechandler.notification.dispatch.model.dto.SyncStats;
import com.wadechandler.notification.dispatch.repository.NotificationRuleRepository;
import com.wadechandler.notification.dispatch.schedule.CronCalendarTranslator;
import com.wadechandler.notification.dispatch.schedule.InMemoryScheduleBackend;
import com.wadechandler.notification.dispatch.schedule.ScheduleIds;
import com.wadechandler.notification.dispatch.schedule.ScheduleSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleSyncServiceTest {

    private static final UUID ENTERPRISE = UUID.fromString("00000000-0000-0000-0000-0000000000e1");
    private static final UUID OTHER_ENTERPRISE = UUID.fromString("00000000-0000-0000-0000-0000000000e2");

    @Mock
    private NotificationRuleRepository ruleRepository;

    private InMemoryScheduleBackend backend;
    private RuleSyncService service;

    @BeforeEach
    void setUp() {
        backend = new InMemoryScheduleBackend();
        service = new RuleSyncService(ruleRepository, backend);
    }

    @Test
    void syncRule_activeCronRuleWithoutSchedule_shouldCreate() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * 1-5");

        assertEquals(SyncAction.CREATED, service.syncRule(rule));

        ScheduleSnapshot created = backend.schedules().get(ScheduleIds.of(1L, ENTERPRISE));
        assertEquals(1L, created.ruleId());
        assertEquals("UTC", created.timezone());
        assertFalse(created.paused());
    }

    @Test
    void syncRule_sameCronTwice_shouldReportUnchangedAndNotWrite() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * 1-5");
        service.syncRule(rule);
        backend.clearCalls();

        assertEquals(SyncAction.UNCHANGED, service.syncRule(rule));
        assertTrue(backend.calls().isEmpty());
    }

    @Test
    void syncRule_cronChanged_shouldUpdate() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        service.syncRule(rule);

        rule.setTriggerConfig(Map.of("cron", "30 17 * * *"));
        assertEquals(SyncAction.UPDATED, service.syncRule(rule));

        ScheduleSnapshot updated = backend.schedules().get(ScheduleIds.of(1L, ENTERPRISE));
        assertTrue(CronCalendarTranslator.translate("30 17 * * *").sameAs(updated.calendar()));
    }

    @Test
    void syncRule_timezoneChanged_shouldUpdate() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        service.syncRule(rule);

        rule.setTriggerConfig(Map.of("cron", "0 9 * * *", "timezone", "America/Chicago"));

        assertEquals(SyncAction.UPDATED, service.syncRule(rule));
        assertEquals("America/Chicago", backend.schedules().get(ScheduleIds.of(1L, ENTERPRISE)).timezone());
    }

    @Test
    void syncRule_payloadAndWorkflowChangedWithSameCron_shouldUpdate() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        rule.setRulePayload(Map.of("recipient", "old-user"));
        rule.setNotificationWorkflowId(7L);
        service.syncRule(rule);
        backend.clearCalls();

        rule.setRulePayload(Map.of("recipient", "new-user"));
        rule.setNotificationWorkflowId(8L);

        assertEquals(SyncAction.UPDATED, service.syncRule(rule));
        assertEquals(List.of("update:" + ScheduleIds.of(1L, ENTERPRISE)), backend.calls());
        assertEquals(SyncAction.UNCHANGED, service.syncRule(rule));
    }

    @Test
    void syncRule_renamedRule_shouldUpdateScheduleNote() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        service.syncRule(rule);

        rule.setName("Renamed reminder");

        assertEquals(SyncAction.UPDATED, service.syncRule(rule));
    }

    @Test
    void reconcileSchedules_payloadChangedWithSameCron_shouldCountUpdate() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        when(ruleRepository.findActiveCronRules(null)).thenReturn(List.of(rule));
        service.reconcileSchedules(null);

        rule.setRulePayload(Map.of("recipients", List.of("a", "b")));

        assertEquals(new ReconciliationStats(0, 1, 0, 0, 0), service.reconcileSchedules(null));
    }

    @Test
    void syncRule_deactivatedRule_shouldDeleteExistingSchedule() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        service.syncRule(rule);

        rule.setDeactivated(true);

        assertEquals(SyncAction.DELETED, service.syncRule(rule));
        assertTrue(backend.schedules().isEmpty());
    }

    @Test
    void syncRule_draftRuleWithoutSchedule_shouldReportAbsent() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        rule.setPublishStatus(PublishStatus.DRAFT);

        assertEquals(SyncAction.ABSENT, service.syncRule(rule));
        assertTrue(backend.schedules().isEmpty());
    }

    @Test
    void syncRule_eventRule_shouldNeverOwnSchedule() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        service.syncRule(rule);

        rule.setTriggerType(TriggerType.EVENT);

        assertEquals(SyncAction.DELETED, service.syncRule(rule));
    }

    @Test
    void syncRules_oneBadCron_shouldCountErrorAndContinue() {
        NotificationRule bad = cronRule(1L, ENTERPRISE, "not a cron");
        NotificationRule good = cronRule(2L, ENTERPRISE, "*/15 * * * *");

        SyncStats stats = service.syncRules(List.of(bad, good));

        assertEquals(2, stats.processed());
        assertEquals(1, stats.created());
        assertEquals(1, stats.errors());
        assertTrue(backend.schedules().containsKey(ScheduleIds.of(2L, ENTERPRISE)));
    }

    @Test
    void syncRules_backendFailureForOneRule_shouldNotStopOthers() {
        backend.failOn(ScheduleIds.of(1L, ENTERPRISE));

        SyncStats stats = service.syncRules(List.of(
                cronRule(1L, ENTERPRISE, "0 9 * * *"),
                cronRule(2L, ENTERPRISE, "0 10 * * *")));

        assertEquals(1, stats.errors());
        assertEquals(1, stats.created());
    }

    @Test
    void reconcileSchedules_shouldCreateMissingAndDeleteOrphans() {
        backend.put(new ScheduleSnapshot(ScheduleIds.of(99L, ENTERPRISE), 99L, ENTERPRISE.toString(),
                CronCalendarTranslator.translate("0 0 * * *"), "UTC", false, null));
        when(ruleRepository.findActiveCronRules(null)).thenReturn(List.of(
                cronRule(1L, ENTERPRISE, "0 9 * * *"),
                cronRule(2L, ENTERPRISE, "0 10 * * *")));

        ReconciliationStats stats = service.reconcileSchedules(null);

        assertEquals(new ReconciliationStats(2, 0, 0, 1, 0), stats);
        assertEquals(2, backend.schedules().size());
        assertFalse(backend.schedules().containsKey(ScheduleIds.of(99L, ENTERPRISE)));
    }

    @Test
    void reconcileSchedules_secondRunWithoutChanges_shouldReportAllUnchanged() {
        when(ruleRepository.findActiveCronRules(null)).thenReturn(List.of(
                cronRule(1L, ENTERPRISE, "0 9 * * *"),
                cronRule(2L, ENTERPRISE, "0 10 * * *")));
        service.reconcileSchedules(null);
        backend.clearCalls();

        ReconciliationStats stats = service.reconcileSchedules(null);

        assertEquals(new ReconciliationStats(0, 0, 2, 0, 0), stats);
        assertTrue(backend.calls().isEmpty());
    }

    @Test
    void reconcileSchedules_manuallyEditedSchedule_shouldBeRestored() {
        NotificationRule rule = cronRule(1L, ENTERPRISE, "0 9 * * *");
        when(ruleRepository.findActiveCronRules(null)).thenReturn(List.of(rule));
        backend.put(new ScheduleSnapshot(ScheduleIds.of(1L, ENTERPRISE), 1L, ENTERPRISE.toString(),
                CronCalendarTranslator.translate("0 12 * * *"), "UTC", true, null));

        ReconciliationStats stats = service.reconcileSchedules(null);

        assertEquals(1, stats.updated());
        ScheduleSnapshot restored = backend.schedules().get(ScheduleIds.of(1L, ENTERPRISE));
        assertFalse(restored.paused());
        assertTrue(CronCalendarTranslator.translate("0 9 * * *").sameAs(restored.calendar()));
    }

    @Test
    void reconcileSchedules_foreignSchedule_shouldBeLeftAlone() {
        backend.put(new ScheduleSnapshot("nightly-report", null, null,
                CronCalendarTranslator.translate("0 2 * * *"), "UTC", false, null));
        when(ruleRepository.findActiveCronRules(null)).thenReturn(List.of());

        ReconciliationStats stats = service.reconcileSchedules(null);

        assertEquals(0, stats.deleted());
        assertTrue(backend.schedules().containsKey("nightly-report"));
    }

    @Test
    void reconcileSchedules_scopedToEnterprise_shouldNotTouchOtherTenants() {
        String otherId = ScheduleIds.of(5L, OTHER_ENTERPRISE);
        backend.put(new ScheduleSnapshot(otherId, 5L, OTHER_ENTERPRISE.toString(),
                CronCalendarTranslator.translate("0 2 * * *"), "UTC", false, null));
        when(ruleRepository.findActiveCronRules(ENTERPRISE)).thenReturn(List.of(cronRule(1L, ENTERPRISE, "0 9 * * *")));

        ReconciliationStats stats = service.reconcileSchedules(ENTERPRISE);

        assertEquals(1, stats.created());
        assertEquals(0, stats.deleted());
        assertTrue(backend.schedules().containsKey(otherId));
    }

    @Test
    void reconcileSchedules_orphanDeleteFails_shouldCountError() {
        String orphan = ScheduleIds.of(99L, ENTERPRISE);
        backend.put(new ScheduleSnapshot(orphan, 99L, ENTERPRISE.toString(), null, null, false, null));
        backend.failOn(orphan);
        when(ruleRepository.findActiveCronRules(null)).thenReturn(List.of());

        ReconciliationStats stats = service.reconcileSchedules(null);

        assertEquals(new ReconciliationStats(0, 0, 0, 0, 1), stats);
    }

    @Test
    void removeSchedule_shouldDeleteByRuleIdentity() {
        service.syncRule(cronRule(7L, ENTERPRISE, "0 9 * * *"));

        assertTrue(service.removeSchedule(7L, ENTERPRISE));
        assertFalse(service.removeSchedule(7L, ENTERPRISE));
    }

    static NotificationRule cronRule(Long id, UUID enterpriseId, String cron) {
        return NotificationRule.builder()
                .id(id)
                .enterpriseId(enterpriseId)
                .name("rule-" + id)
                .triggerType(TriggerType.CRON)
                .triggerConfig(Map.of("cron", cron))
                .rulePayload(Map.of("recipient", "user-" + id))
                .notificationWorkflowId(10L)
                .publishStatus(PublishStatus.PUBLISH)
                .deactivated(false)
                .build();
    }
}
