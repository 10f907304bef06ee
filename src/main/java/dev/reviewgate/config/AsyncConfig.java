package dev.reviewgate.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Bounded executor for background reviews. Reviews are I/O-bound (hosting API and model
 * calls), so a small pool is enough; the queue absorbs bursts.
 *
 * <p>MDC is copied onto the worker so the {@code pr} key stays in every log line of a
 * review.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "reviewExecutor")
    public ThreadPoolTaskExecutor reviewExecutor(ReviewProperties reviewProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(reviewProperties.executorPoolSize());
        executor.setMaxPoolSize(reviewProperties.executorPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("review-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

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
