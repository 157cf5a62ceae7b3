package com.dagflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings bound from {@code dagflow.engine.*}.
 */
@ConfigurationProperties(prefix = "dagflow.engine")
public class EngineProperties {

    /**
     * Upper bound on task functions executing at the same time, across all workflows
     */
    private int maxConcurrentTasks = 10;

    /**
     * Deadline applied to tasks that do not set their own timeout
     */
    private Duration defaultTaskTimeout = Duration.ofSeconds(300);

    /**
     * Prefix for engine thread names
     */
    private String threadNamePrefix = "dagflow-";

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public void setMaxConcurrentTasks(int maxConcurrentTasks) {
        this.maxConcurrentTasks = maxConcurrentTasks;
    }

    public Duration getDefaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    public void setDefaultTaskTimeout(Duration defaultTaskTimeout) {
        this.defaultTaskTimeout = defaultTaskTimeout;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
