package com.wadechandler.notification.dispatch.schedule;

import com.wadechandler.notification.dispatch.config.TaskQueues;
import com.wadechandler.notification.dispatch.exception.ScheduleBackendException;
import com.wadechandler.notification.dispatch.model.NotificationRule;
import com.wadechandler.notification.dispatch.model.PublishStatus;
import com.wadechandler.notification.dispatch.model.TriggerType;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.temporal.client.schedules.Schedule;
import io.temporal.client.schedules.ScheduleActionStartWorkflow;
import io.temporal.client.schedules.ScheduleCalendarSpec;
import io.temporal.client.schedules.ScheduleClient;
import io.temporal.client.schedules.ScheduleHandle;
import io.temporal.client.schedules.ScheduleOptions;
import io.temporal.client.schedules.ScheduleRange;
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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TemporalScheduleBackendTest {

    private static final UUID ENTERPRISE = UUID.fromString("00000000-0000-0000-0000-0000000000e1");

    @Mock
    private ScheduleClient scheduleClient;

    @Mock
    private ScheduleHandle handle;

    private TemporalScheduleBackend backend;
    private ScheduleDefinition definition;

    @BeforeEach
    void setUp() {
        backend = new TemporalScheduleBackend(scheduleClient);
        definition = ScheduleDefinition.forRule(NotificationRule.builder()
                .id(42L)
                .enterpriseId(ENTERPRISE)
                .name("Weekday reminder")
                .triggerType(TriggerType.CRON)
                .triggerConfig(Map.of("cron", "30 9 * * 1-5", "timezone", "Europe/Berlin"))
                .rulePayload(Map.of("recipient", "user-1"))
                .notificationWorkflowId(10L)
                .publishStatus(PublishStatus.PUBLISH)
                .build());
    }

    @Test
    void toSchedule_shouldCarryCalendarTimezoneStateAndAction() {
        Schedule schedule = TemporalScheduleBackend.toSchedule(definition);

        ScheduleCalendarSpec calendar = schedule.getSpec().getCalendars().get(0);
        assertEquals(List.of(CalendarRange.single(0)), ranges(calendar.getSeconds()));
        assertEquals(List.of(CalendarRange.single(30)), ranges(calendar.getMinutes()));
        assertEquals(List.of(CalendarRange.single(9)), ranges(calendar.getHour()));
        assertEquals(List.of(new CalendarRange(1, 5, 1)), ranges(calendar.getDayOfWeek()));
        assertEquals("Europe/Berlin", schedule.getSpec().getTimeZoneName());
        assertFalse(schedule.getState().isPaused());
        assertEquals("Notification rule: Weekday reminder", schedule.getState().getNote());

        ScheduleActionStartWorkflow action = (ScheduleActionStartWorkflow) schedule.getAction();
        assertEquals("RuleScheduledWorkflow", action.getWorkflowType());
        assertEquals(TaskQueues.RULE_SCHEDULE_QUEUE, action.getOptions().getTaskQueue());
        assertEquals("rule-run-42-" + ENTERPRISE, action.getOptions().getWorkflowId());
    }

    @Test
    void toSnapshot_ofBuiltSchedule_shouldMatchDefinition() {
        Schedule schedule = TemporalScheduleBackend.toSchedule(definition);

        ScheduleSnapshot snapshot = TemporalScheduleBackend.toSnapshot(
                definition.scheduleId(), schedule, "42", ENTERPRISE.toString());

        assertEquals(definition.actionHash(), snapshot.actionHash());
        assertEquals(42L, snapshot.ruleId());
        assertEquals(ENTERPRISE.toString(), snapshot.enterpriseId());
        assertTrue(definition.matches(snapshot));
    }

    @Test
    void toSnapshot_ofScheduleWithOldPayload_shouldNotMatchEditedRule() {
        Schedule old = TemporalScheduleBackend.toSchedule(definition);
        ScheduleSnapshot snapshot = TemporalScheduleBackend.toSnapshot(
                definition.scheduleId(), old, "42", ENTERPRISE.toString());

        ScheduleDefinition edited = ScheduleDefinition.forRule(NotificationRule.builder()
                .id(42L)
                .enterpriseId(ENTERPRISE)
                .name("Weekday reminder")
                .triggerType(TriggerType.CRON)
                .triggerConfig(Map.of("cron", "30 9 * * 1-5", "timezone", "Europe/Berlin"))
                .rulePayload(Map.of("recipient", "user-2"))
                .notificationWorkflowId(11L)
                .publishStatus(PublishStatus.PUBLISH)
                .build());

        assertFalse(edited.matches(snapshot));
    }

    @Test
    void toSnapshot_missingMemo_shouldLeaveIdentityEmpty() {
        ScheduleSnapshot snapshot = TemporalScheduleBackend.toSnapshot(
                "nightly-report", TemporalScheduleBackend.toSchedule(definition), null, "null");

        assertNull(snapshot.ruleId());
        assertNull(snapshot.enterpriseId());
        assertFalse(snapshot.isRuleOwned());
    }

    @Test
    void memo_shouldIdentifyRule() {
        assertEquals(Map.of(
                        TemporalScheduleBackend.MEMO_RULE_ID, "42",
                        TemporalScheduleBackend.MEMO_ENTERPRISE_ID, ENTERPRISE.toString(),
                        TemporalScheduleBackend.MEMO_RULE_NAME, "Weekday reminder"),
                TemporalScheduleBackend.memo(definition));
    }

    @Test
    void hasStatus_shouldFindCodeInCauseChain() {
        RuntimeException wrapped = new RuntimeException("outer",
                new IllegalStateException("middle", new StatusRuntimeException(Status.NOT_FOUND)));

        assertTrue(TemporalScheduleBackend.hasStatus(wrapped, Status.Code.NOT_FOUND));
        assertFalse(TemporalScheduleBackend.hasStatus(wrapped, Status.Code.ALREADY_EXISTS));
        assertFalse(TemporalScheduleBackend.hasStatus(new RuntimeException("plain"), Status.Code.NOT_FOUND));
    }

    @Test
    void deleteSchedule_notFound_shouldReturnFalse() {
        when(scheduleClient.getHandle("rule-missing")).thenReturn(handle);
        doThrow(new StatusRuntimeException(Status.NOT_FOUND)).when(handle).delete();

        assertFalse(backend.deleteSchedule("rule-missing"));
    }

    @Test
    void deleteSchedule_unavailable_shouldThrowBackendException() {
        when(scheduleClient.getHandle("rule-x")).thenReturn(handle);
        doThrow(new StatusRuntimeException(Status.UNAVAILABLE)).when(handle).delete();

        assertThrows(ScheduleBackendException.class, () -> backend.deleteSchedule("rule-x"));
    }

    @Test
    void getSchedule_notFound_shouldReturnEmpty() {
        when(scheduleClient.getHandle("rule-missing")).thenReturn(handle);
        when(handle.describe()).thenThrow(new StatusRuntimeException(Status.NOT_FOUND));

        assertTrue(backend.getSchedule("rule-missing").isEmpty());
    }

    @Test
    void updateSchedule_notFound_shouldCreateInstead() {
        when(scheduleClient.getHandle(definition.scheduleId())).thenReturn(handle);
        doThrow(new StatusRuntimeException(Status.NOT_FOUND)).when(handle).update(any());

        backend.updateSchedule(definition);

        verify(scheduleClient).createSchedule(eq(definition.scheduleId()), any(Schedule.class), any(ScheduleOptions.class));
    }

    @Test
    void createSchedule_alreadyExists_shouldUpdateInstead() {
        when(scheduleClient.createSchedule(eq(definition.scheduleId()), any(Schedule.class), any(ScheduleOptions.class)))
                .thenThrow(new StatusRuntimeException(Status.ALREADY_EXISTS));
        when(scheduleClient.getHandle(definition.scheduleId())).thenReturn(handle);

        backend.createSchedule(definition);

        verify(handle).update(any());
    }

    @Test
    void createSchedule_otherFailure_shouldThrowBackendException() {
        when(scheduleClient.createSchedule(eq(definition.scheduleId()), any(Schedule.class), any(ScheduleOptions.class)))
                .thenThrow(new StatusRuntimeException(Status.DEADLINE_EXCEEDED));

        assertThrows(ScheduleBackendException.class, () -> backend.createSchedule(definition));
    }

    private static List<CalendarRange> ranges(List<ScheduleRange> ranges) {
        return ranges.stream()
                .map(r -> new CalendarRange(r.getStart(), r.getEnd(), r.getStep()).normalized())
                .toList();
    }
}
