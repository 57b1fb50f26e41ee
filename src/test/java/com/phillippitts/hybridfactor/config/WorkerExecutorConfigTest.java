package com.phillippitts.hybridfactor.config;

import com.phillippitts.hybridfactor.config.properties.WorkerExecutorProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerExecutorConfigTest {

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateThreadPerTaskExecutor() {
        Executor executor = new WorkerExecutorConfig(new WorkerExecutorProperties()).factorWorkerExecutor();

        assertThat(executor).isInstanceOf(SimpleAsyncTaskExecutor.class);
        SimpleAsyncTaskExecutor simple = (SimpleAsyncTaskExecutor) executor;
        assertThat(simple.getThreadNamePrefix()).isEqualTo("factor-worker-");
        assertThat(simple.isDaemon()).isTrue();
        assertThat(simple.isThrottleActive()).isFalse();
    }

    @Test
    void shouldRunEveryTaskConcurrently() throws InterruptedException {
        Executor executor = new WorkerExecutorConfig(new WorkerExecutorProperties()).factorWorkerExecutor();
        int taskCount = 10;
        CountDownLatch allRunning = new CountDownLatch(taskCount);
        CountDownLatch release = new CountDownLatch(1);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                allRunning.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        // would time out if tasks were queued behind each other
        assertThat(allRunning.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
    }

    @Test
    void shouldUseConfiguredThreadNameAndDaemonFlag() throws InterruptedException {
        WorkerExecutorProperties props = new WorkerExecutorProperties();
        props.setThreadNamePrefix("race-");
        props.setDaemon(false);
        Executor executor = new WorkerExecutorConfig(props).factorWorkerExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> name = new AtomicReference<>();
        AtomicBoolean daemon = new AtomicBoolean(true);

        executor.execute(() -> {
            name.set(Thread.currentThread().getName());
            daemon.set(Thread.currentThread().isDaemon());
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(name.get()).startsWith("race-");
        assertThat(daemon.get()).isFalse();
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        Executor executor = new WorkerExecutorConfig(new WorkerExecutorProperties()).factorWorkerExecutor();
        ThreadContext.put("raceId", "race-7");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("raceId"));
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("race-7");
    }
}
