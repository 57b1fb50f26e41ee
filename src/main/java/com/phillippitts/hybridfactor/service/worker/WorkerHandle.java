package com.phillippitts.hybridfactor.service.worker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Start-and-join lifecycle around one worker.
 *
 * <p>Lifecycle: {@link State#CREATED} → {@link #start(Executor)} → {@link State#RUNNING} →
 * loop exits → {@link State#FINISHED}. {@code start} returns immediately; {@link #join(Duration)}
 * blocks until the loop exits or the wait elapses. A handle can be started once.
 */
public final class WorkerHandle {

    private static final Logger LOG = LogManager.getLogger(WorkerHandle.class);

    public enum State { CREATED, RUNNING, FINISHED }

    private final AbstractFactorWorker worker;
    private volatile CompletableFuture<Void> completion;

    public WorkerHandle(AbstractFactorWorker worker) {
        this.worker = Objects.requireNonNull(worker, "worker");
    }

    /**
     * Submits the worker's loop to {@code executor}.
     *
     * @throws IllegalStateException if the handle was already started
     */
    public synchronized void start(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        if (completion != null) {
            throw new IllegalStateException(worker.workerId() + " already started");
        }
        completion = CompletableFuture.runAsync(worker, executor);
    }

    /**
     * Waits up to {@code timeout} for the loop to exit.
     *
     * @return true if the worker has finished
     * @throws IllegalStateException if the handle was never started
     */
    public boolean join(Duration timeout) {
        CompletableFuture<Void> f = requireStarted();
        try {
            f.get(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return f.isDone();
        } catch (ExecutionException e) {
            LOG.error("{} terminated abnormally", worker.workerId(), e.getCause());
            return true;
        }
    }

    public State state() {
        CompletableFuture<Void> f = completion;
        if (f == null) {
            return State.CREATED;
        }
        return f.isDone() ? State.FINISHED : State.RUNNING;
    }

    public boolean isFinished() {
        return state() == State.FINISHED;
    }

    /** Future completed when the loop exits. */
    public CompletableFuture<Void> completion() {
        return requireStarted();
    }

    /**
     * Outcome of the loop; FAULTED when it died on an error the worker could not catch,
     * null while it is running.
     */
    public WorkerOutcome outcome() {
        WorkerOutcome outcome = worker.outcome();
        if (outcome == null && isFinished()) {
            return WorkerOutcome.FAULTED;
        }
        return outcome;
    }

    public Throwable fault() {
        return worker.fault();
    }

    public String workerId() {
        return worker.workerId();
    }

    public WorkerKind kind() {
        return worker.kind();
    }

    public String parameter() {
        return worker.parameter();
    }

    private CompletableFuture<Void> requireStarted() {
        CompletableFuture<Void> f = completion;
        if (f == null) {
            throw new IllegalStateException(worker.workerId() + " not started");
        }
        return f;
    }

    @Override
    public String toString() {
        return "WorkerHandle[" + worker.workerId() + ", " + worker.parameter() + ", " + state() + "]";
    }
}
