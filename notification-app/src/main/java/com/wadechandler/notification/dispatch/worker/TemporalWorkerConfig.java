package com.wadechandler.notification.dispatch.worker;

import com.wadechandler.notification.dispatch.activity.RuleScheduleActivitiesImpl;
import com.wadechandler.notification.dispatch.config.TaskQueues;
import com.wadechandler.notification.dispatch.workflow.RuleScheduledWorkflowImpl;
import io.temporal.client.WorkflowClient;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Temporal worker for the {@code schedule-worker} profile. Runs the workflow that rule
 * schedules start, together with the activity that turns a firing into a PENDING notification.
 * <p>
 * WorkflowClient and WorkflowServiceStubs are provided by {@link TemporalClientConfig}.
 */
@Configuration
@Profile("schedule-worker")
public class TemporalWorkerConfig {

    @Bean(initMethod = "start", destroyMethod = "shutdownNow")
    public WorkerFactory ruleScheduleWorkerFactory(
            WorkflowClient workflowClient,
            RuleScheduleActivitiesImpl ruleScheduleActivities) {
        WorkerFactory factory = WorkerFactory.newInstance(workflowClient);
        Worker worker = factory.newWorker(TaskQueues.RULE_SCHEDULE_QUEUE);
        worker.registerWorkflowImplementationTypes(RuleScheduledWorkflowImpl.class);
        worker.registerActivitiesImplementations(ruleScheduleActivities);
        return factory;
    }
}
