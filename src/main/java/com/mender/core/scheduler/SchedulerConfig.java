package com.mender.core.scheduler;

import com.mender.core.engine.MenderProperties;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

/**
 * Worker pools for mission processing.
 * <p>
 * Missions run on {@code mission-} threads sized to the admission cap, so every
 * admitted mission starts immediately. Collaborator calls run on a separate
 * {@code collaborator-} pool so a mission thread can stop waiting on a slow call.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "missionExecutor")
    public ThreadPoolTaskExecutor missionExecutor(MenderProperties properties) {
        int size = Math.max(1, properties.getMaxConcurrentMissions());
        var executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("mission-");
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size);
        executor.setTaskDecorator(mdcPropagating());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getShutdownTimeoutSeconds());
        executor.initialize();
        return executor;
    }

    @Bean(name = "collaboratorExecutor")
    public ThreadPoolTaskExecutor collaboratorExecutor(MenderProperties properties) {
        int size = Math.max(1, properties.getMaxConcurrentMissions()) * 2;
        var executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("collaborator-");
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /** Copies the submitting thread's MDC onto the worker for the duration of the task. */
    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                } else {
                    MDC.clear();
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
