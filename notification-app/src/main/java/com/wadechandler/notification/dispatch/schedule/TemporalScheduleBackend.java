package com.wadechandler.notification.dispatch.schedule;

import com.wadechandler.notification.dispatch.config.TaskQueues;
import com.wadechandler.notification.dispatch.exception.ScheduleBackendException;
import com.wadechandler.notification.dispatch.model.dto.RuleScheduledInput;
import com.wadechandler.notification.dispatch.workflow.RuleScheduledWorkflow;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.schedules.Schedule;
import io.temporal.client.schedules.ScheduleActionStartWorkflow;
import io.temporal.client.schedules.ScheduleCalendarSpec;
import io.temporal.client.schedules.ScheduleClient;
import io.temporal.client.schedules.ScheduleDescription;
import io.temporal.client.schedules.ScheduleHandle;
import io.temporal.client.schedules.ScheduleListDescription;
import io.temporal.client.schedules.ScheduleOptions;
import io.temporal.client.schedules.ScheduleRange;
import io.temporal.client.schedules.ScheduleSpec;
import io.temporal.client.schedules.ScheduleState;
import io.temporal.client.schedules.ScheduleUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link ScheduleBackend} on Temporal Schedules. Each rule schedule carries a single calendar
 * spec, a time zone, a memo identifying the rule, and an action that starts
 * {@link RuleScheduledWorkflow} on {@code RULE_SCHEDULE_QUEUE}.
 */
@Component
@Profile("reconciler")
@RequiredArgsConstructor
@Slf4j
public class TemporalScheduleBackend implements ScheduleBackend {

    static final String MEMO_RULE_ID = "ruleId";
    static final String MEMO_ENTERPRISE_ID = "enterpriseId";
    static final String MEMO_RULE_NAME = "ruleName";

    private final ScheduleClient scheduleClient;

    @Override
    public void createSchedule(ScheduleDefinition definition) {
        try {
            scheduleClient.createSchedule(definition.scheduleId(), toSchedule(definition),
                    ScheduleOptions.newBuilder()
                            .setMemo(memo(definition))
                            .build());
            log.info("Created schedule {} for rule {}", definition.scheduleId(), definition.ruleId());
        } catch (RuntimeException e) {
            if (hasStatus(e, Status.Code.ALREADY_EXISTS)) {
                log.info("Schedule {} already exists, updating instead", definition.scheduleId());
                try {
                    update(definition);
                    return;
                } catch (RuntimeException updateError) {
                    throw backendFailure("update", definition.scheduleId(), updateError);
                }
            }
            throw backendFailure("create", definition.scheduleId(), e);
        }
    }

    @Override
    public void updateSchedule(ScheduleDefinition definition) {
        try {
            update(definition);
        } catch (RuntimeException e) {
            if (hasStatus(e, Status.Code.NOT_FOUND)) {
                log.info("Schedule {} not found on update, creating it", definition.scheduleId());
                createSchedule(definition);
                return;
            }
            throw backendFailure("update", definition.scheduleId(), e);
        }
    }

    @Override
    public boolean deleteSchedule(String scheduleId) {
        try {
            scheduleClient.getHandle(scheduleId).delete();
            log.info("Deleted schedule {}", scheduleId);
            return true;
        } catch (RuntimeException e) {
            if (hasStatus(e, Status.Code.NOT_FOUND)) {
                log.debug("Schedule {} already absent", scheduleId);
                return false;
            }
            throw backendFailure("delete", scheduleId, e);
        }
    }

    @Override
    public Optional<ScheduleSnapshot> getSchedule(String scheduleId) {
        try {
            ScheduleDescription description = scheduleClient.getHandle(scheduleId).describe();
            return Optional.of(toSnapshot(scheduleId, description.getSchedule(),
                    description.getMemo(MEMO_RULE_ID, String.class, String.class),
                    description.getMemo(MEMO_ENTERPRISE_ID, String.class, String.class)));
        } catch (RuntimeException e) {
            if (hasStatus(e, Status.Code.NOT_FOUND)) {
                return Optional.empty();
            }
            throw backendFailure("describe", scheduleId, e);
        }
    }

    @Override
    public List<ScheduleSnapshot> listSchedules(UUID enterpriseId) {
        try {
            return scheduleClient.listSchedules()
                    .map(TemporalScheduleBackend::toSnapshot)
                    .filter(snapshot -> snapshot.belongsTo(enterpriseId))
                    .toList();
        } catch (RuntimeException e) {
            throw backendFailure("list", "*", e);
        }
    }

    private void update(ScheduleDefinition definition) {
        ScheduleHandle handle = scheduleClient.getHandle(definition.scheduleId());
        Schedule schedule = toSchedule(definition);
        handle.update(input -> new ScheduleUpdate(schedule));
        log.info("Updated schedule {} for rule {}", definition.scheduleId(), definition.ruleId());
    }

    static Schedule toSchedule(ScheduleDefinition definition) {
        CronCalendar calendar = definition.calendar();
        ScheduleCalendarSpec calendarSpec = ScheduleCalendarSpec.newBuilder()
                .setSeconds(List.of(new ScheduleRange(0)))
                .setMinutes(toRanges(calendar.minutes()))
                .setHour(toRanges(calendar.hours()))
                .setDayOfMonth(toRanges(calendar.daysOfMonth()))
                .setMonth(toRanges(calendar.months()))
                .setDayOfWeek(toRanges(calendar.daysOfWeek()))
                .build();

        return Schedule.newBuilder()
                .setAction(ScheduleActionStartWorkflow.newBuilder()
                        .setWorkflowType(RuleScheduledWorkflow.class)
                        .setArguments(definition.action())
                        .setOptions(WorkflowOptions.newBuilder()
                                .setWorkflowId("rule-run-" + definition.ruleId() + "-" + definition.enterpriseId())
                                .setTaskQueue(TaskQueues.RULE_SCHEDULE_QUEUE)
                                .build())
                        .build())
                .setSpec(ScheduleSpec.newBuilder()
                        .setCalendars(List.of(calendarSpec))
                        .setTimeZoneName(definition.timezone())
                        .build())
                .setState(ScheduleState.newBuilder()
                        .setPaused(definition.paused())
                        .setNote(definition.note())
                        .build())
                .build();
    }

    static Map<String, Object> memo(ScheduleDefinition definition) {
        return Map.of(
                MEMO_RULE_ID, String.valueOf(definition.ruleId()),
                MEMO_ENTERPRISE_ID, String.valueOf(definition.enterpriseId()),
                MEMO_RULE_NAME, definition.ruleName() == null ? "" : definition.ruleName());
    }

    static ScheduleSnapshot toSnapshot(String scheduleId, Schedule schedule, String memoRuleId, String memoEnterpriseId) {
        CronCalendar calendar = null;
        String timezone = null;
        ScheduleSpec spec = schedule.getSpec();
        if (spec != null) {
            timezone = spec.getTimeZoneName();
            List<ScheduleCalendarSpec> calendars = spec.getCalendars();
            if (calendars != null && calendars.size() == 1) {
                calendar = toCalendar(calendars.get(0));
            }
        }
        boolean paused = schedule.getState() != null && schedule.getState().isPaused();
        String note = schedule.getState() != null ? schedule.getState().getNote() : null;
        RuleScheduledInput input = actionInput(scheduleId, schedule);
        return new ScheduleSnapshot(scheduleId, parseRuleId(memoRuleId), blankToNull(memoEnterpriseId),
                calendar, timezone, paused, input == null ? null : ScheduleDefinition.actionHash(note, input));
    }

    /**
     * The workflow argument the schedule starts with, or null if it is not a rule action or cannot be decoded.
     * A null makes the schedule differ from every definition, so the next sync rewrites it.
     */
    private static RuleScheduledInput actionInput(String scheduleId, Schedule schedule) {
        if (!(schedule.getAction() instanceof ScheduleActionStartWorkflow action) || action.getArguments() == null) {
            return null;
        }
        try {
            return action.getArguments().get(0, RuleScheduledInput.class);
        } catch (RuntimeException e) {
            log.debug("Schedule {} has an action argument that is not a rule input: {}", scheduleId, e.getMessage());
            return null;
        }
    }

    private static ScheduleSnapshot toSnapshot(ScheduleListDescription entry) {
        return new ScheduleSnapshot(entry.getScheduleId(),
                parseRuleId(entry.getMemo(MEMO_RULE_ID, String.class, String.class)),
                blankToNull(entry.getMemo(MEMO_ENTERPRISE_ID, String.class, String.class)),
                null, null, false, null);
    }

    private static CronCalendar toCalendar(ScheduleCalendarSpec spec) {
        return new CronCalendar(
                fromRanges(spec.getMinutes()),
                fromRanges(spec.getHour()),
                fromRanges(spec.getDayOfMonth()),
                fromRanges(spec.getMonth()),
                fromRanges(spec.getDayOfWeek()));
    }

    private static List<ScheduleRange> toRanges(List<CalendarRange> ranges) {
        return ranges.stream()
                .map(r -> new ScheduleRange(r.start(), r.end(), r.step()))
                .toList();
    }

    private static List<CalendarRange> fromRanges(List<ScheduleRange> ranges) {
        if (ranges == null) {
            return List.of();
        }
        return ranges.stream()
                .map(r -> new CalendarRange(r.getStart(), r.getEnd(), r.getStep()))
                .toList();
    }

    private static Long parseRuleId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() || value.equals("null") ? null : value;
    }

    /**
     * The SDK wraps gRPC failures in its own exception types; the status code is somewhere in the cause chain.
     */
    static boolean hasStatus(Throwable error, Status.Code code) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof StatusRuntimeException sre && sre.getStatus().getCode() == code) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static ScheduleBackendException backendFailure(String operation, String scheduleId, RuntimeException e) {
        return new ScheduleBackendException("Failed to " + operation + " schedule " + scheduleId, e);
    }
}
