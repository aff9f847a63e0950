package com.wadechandler.notification.dispatch.workflow;

import com.wadechandler.notification.dispatch.activity.RuleScheduleActivities;
import com.wadechandler.notification.dispatch.config.TaskQueues;
import com.wadechandler.notification.dispatch.exception.InvalidRuleInputException;
import com.wadechandler.notification.dispatch.exception.NoRecipientsException;
import com.wadechandler.notification.dispatch.exception.RuleNotFoundException;
import com.wadechandler.notification.dispatch.exception.WorkflowNotFoundException;
import com.wadechandler.notification.dispatch.model.dto.RuleScheduledInput;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;

/**
 * Hands a schedule firing over to the dispatcher by inserting a PENDING notification.
 * <p>
 * This workflow is NOT a Spring bean. Temporal instantiates it, and all I/O happens in the activity.
 * Failures that retrying cannot fix (missing rule, workflow or recipients) are not retried.
 */
public class RuleScheduledWorkflowImpl implements RuleScheduledWorkflow {

    private static final Logger log = Workflow.getLogger(RuleScheduledWorkflowImpl.class);

    private final RuleScheduleActivities activities = Workflow.newActivityStub(
            RuleScheduleActivities.class,
            ActivityOptions.newBuilder()
                    .setTaskQueue(TaskQueues.RULE_SCHEDULE_QUEUE)
                    .setStartToCloseTimeout(Duration.ofSeconds(30))
                    .setRetryOptions(RetryOptions.newBuilder()
                            .setInitialInterval(Duration.ofSeconds(1))
                            .setBackoffCoefficient(2.0)
                            .setMaximumInterval(Duration.ofSeconds(30))
                            .setMaximumAttempts(3)
                            .setDoNotRetry(
                                    InvalidRuleInputException.class.getName(),
                                    RuleNotFoundException.class.getName(),
                                    WorkflowNotFoundException.class.getName(),
                                    NoRecipientsException.class.getName())
                            .build())
                    .build());

    @Override
    public Long run(RuleScheduledInput input) {
        log.info("Rule {} fired for enterprise {}", input.ruleId(), input.enterpriseId());
        Long notificationId = activities.createNotificationFromRule(input);
        if (notificationId == null) {
            log.info("Rule {} is no longer active, no notification created", input.ruleId());
        } else {
            log.info("Rule {} created notification {}", input.ruleId(), notificationId);
        }
        return notificationId;
    }
}
