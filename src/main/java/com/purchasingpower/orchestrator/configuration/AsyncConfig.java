package com.purchasingpower.orchestrator.configuration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for request-scoped workflow execution.
 *
 * <ul>
 *   <li>workflowExecutor - one task per incoming request</li>
 *   <li>phaseExecutor - phase bodies, so each phase can be timed out independently</li>
 *   <li>specialistExecutor - one unit per selected domain inside execute_planning</li>
 * </ul>
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig implements AsyncConfigurer {

    private final ExecutorProperties executorProperties;

    @Bean(name = "workflowExecutor")
    @Override
    public ThreadPoolTaskExecutor getAsyncExecutor() {
        return build("workflow-", executorProperties.getWorkflow(), true);
    }

    @Bean(name = "phaseExecutor")
    public ThreadPoolTaskExecutor phaseExecutor() {
        return build("workflow-phase-", executorProperties.getPhase(), false);
    }

    @Bean(name = "specialistExecutor")
    public ThreadPoolTaskExecutor specialistExecutor() {
        return build("specialist-", executorProperties.getSpecialist(), false);
    }

    private ThreadPoolTaskExecutor build(String prefix, ExecutorProperties.Pool pool, boolean waitOnShutdown) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(pool.getCorePoolSize(), pool.getMaxPoolSize()));
        // 0 means direct hand-off to a new thread
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(waitOnShutdown);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("✅ Executor '{}' configured: core={}, max={}, queue={}",
                prefix, executor.getCorePoolSize(), executor.getMaxPoolSize(), pool.getQueueCapacity());
        return executor;
    }
}
