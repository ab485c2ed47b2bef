package com.supplychain.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Slf4j
@Configuration
public class ExecutorConfig {

    /**
     * Bounded pool behind {@code EventPipeline.submit}. Queued work is dropped on
     * shutdown; nothing is durable before the sinks run.
     */
    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor(PipelineProperties properties) {
        int workers = properties.getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("Pipeline executor started: workers={}, queueCapacity={}", workers, properties.getQueueCapacity());
        return executor;
    }
}
