package com.dagflow.config;

import com.dagflow.engine.WorkflowEngine;
import com.dagflow.registry.TaskFunctionRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one engine per application context. Components that submit or query workflows
 * get the engine injected instead of reaching for a global.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public TaskFunctionRegistry taskFunctionRegistry() {
        return new TaskFunctionRegistry();
    }

    @Bean(destroyMethod = "shutdown")
    public WorkflowEngine workflowEngine(EngineProperties properties, TaskFunctionRegistry taskFunctionRegistry) {
        return new WorkflowEngine(properties.getMaxConcurrentTasks(), properties.getDefaultTaskTimeout(),
                taskFunctionRegistry, properties.getThreadNamePrefix());
    }
}
