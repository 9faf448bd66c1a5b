package io.github.drompincen.agentlink.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class SchedulerConfig {

    @Bean
    ThreadPoolTaskScheduler taskScheduler(AgentLinkProperties properties) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("agentlink-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /** Reconnect delays, control retries and tool status transitions all run here. */
    @Bean
    ScheduledExecutorService agentScheduler(ThreadPoolTaskScheduler taskScheduler) {
        return taskScheduler.getScheduledExecutor();
    }
}
