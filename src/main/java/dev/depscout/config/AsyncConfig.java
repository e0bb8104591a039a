package dev.depscout.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

/**
 * Async execution configuration.
 *
 * <p>Resolution jobs run on a bounded pool sized by {@link PipelineProperties}. When both the
 * pool and its queue are full the executor rejects the task and the orchestrator fails the
 * job immediately instead of leaving it in processing.
 *
 * <p>MDC is copied onto the worker thread so the job id survives the async hop in logs.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "resolutionExecutor")
    public ThreadPoolTaskExecutor resolutionExecutor(PipelineProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(props.corePoolSize());
        executor.setMaxPoolSize(props.maxPoolSize());
        executor.setQueueCapacity(props.queueCapacity());
        executor.setThreadNamePrefix("resolution-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Propagates MDC context (requestId, jobId) from the submitting thread to the worker.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
