package com.phillippitts.hybridfactor.config;

import com.phillippitts.hybridfactor.config.properties.WorkerExecutorProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Executor configuration for racing workers.
 */
@Configuration
public class WorkerExecutorConfig {

    private final WorkerExecutorProperties properties;

    public WorkerExecutorConfig(WorkerExecutorProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the executor that runs factoring workers.
     *
     * <p>One new thread per task, no queue and no concurrency limit: a queued worker would
     * never beat, and a caller-runs fallback would block the coordinator inside a worker loop.
     *
     * <p>Thread naming: configured via {@code threadpool.worker.thread-name-prefix}.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (race id, N) from the coordinator
     * thread to the worker thread.
     *
     * @return executor for factoring workers
     */
    @Bean(name = "factorWorkerExecutor")
    public Executor factorWorkerExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor(properties.getThreadNamePrefix());
        executor.setDaemon(properties.isDaemon());
        executor.setTaskDecorator(threadContextDecorator());
        return executor;
    }

    static TaskDecorator threadContextDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
