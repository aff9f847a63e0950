package com.wadechandler.notification.dispatch.worker;

import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.client.schedules.ScheduleClient;
import io.temporal.client.schedules.ScheduleClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Temporal client beans shared by the reconciler (to manage rule schedules) and the
 * schedule-worker (to run the workflow a fired schedule starts). Separated from
 * {@link TemporalWorkerConfig} so that the reconciler gets its clients without a worker factory.
 */
@Configuration
@Profile({"reconciler", "schedule-worker"})
public class TemporalClientConfig {

    @Bean(destroyMethod = "shutdown")
    public WorkflowServiceStubs workflowServiceStubs(
            @Value("${temporal.connection.target}") String target) {
        return WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(target)
                        .build());
    }

    @Bean
    public WorkflowClient workflowClient(
            WorkflowServiceStubs serviceStubs,
            @Value("${temporal.namespace:default}") String namespace) {
        return WorkflowClient.newInstance(serviceStubs,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(namespace)
                        .build());
    }

    @Bean
    @Profile("reconciler")
    public ScheduleClient scheduleClient(
            WorkflowServiceStubs serviceStubs,
            @Value("${temporal.namespace:default}") String namespace) {
        return ScheduleClient.newInstance(serviceStubs,
                ScheduleClientOptions.newBuilder()
                        .setNamespace(namespace)
                        .build());
    }
}
