package com.wadechandler.notification.dispatch.workflow;

import com.wadechandler.notification.dispatch.model.dto.RuleScheduledInput;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Started by a rule's Temporal schedule every time it fires.
 */
@WorkflowInterface
public interface RuleScheduledWorkflow {

    /**
     * @return id of the created notification, or null when the rule is no longer active
     */
    @WorkflowMethod
    Long run(RuleScheduledInput input);
}
