package dev.llumos.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for batch execution.
 *
 * <p>Both pools are bounded: provider calls are I/O-bound but rate limited upstream, and each
 * driver occupies a thread for the lifetime of a job. MDC (correlationId, jobId) is copied onto
 * worker threads so log lines stay attributable to their job.
 */
@Configuration
public class AsyncConfig {

    /**
     * Runs driver loops. No queue: when every driver thread is busy the job is left for the
     * reconciler instead of waiting behind a long-running job.
     */
    @Bean(name = "driverExecutor")
    public TaskExecutor driverExecutor(BatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(properties.driver().poolSize());
        executor.setMaxPoolSize(properties.driver().poolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("batch-driver-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Prompt groups of an executor invocation run here. Sized for every driver plus one
     * client-polled invocation at full width; each invocation still caps its own in-flight calls.
     */
    @Bean(name = "providerCallExecutor", destroyMethod = "shutdown")
    public ExecutorService providerCallExecutor(BatchProperties properties) {
        int threads = properties.maxConcurrentCalls() * (properties.driver().poolSize() + 1);
        ExecutorService base = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("provider-call-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
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

    /**
     * Applies MDC propagation to everything submitted to the wrapped executor.
     */
    static class DelegatingExecutorService extends java.util.concurrent.AbstractExecutorService {
        private final ExecutorService delegate;
        private final MdcPropagatingTaskDecorator decorator;

        DelegatingExecutorService(ExecutorService delegate, MdcPropagatingTaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public java.util.List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, java.util.concurrent.TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}
