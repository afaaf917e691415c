package com.depforge.git;

import com.depforge.core.logging.MdcContext;
import com.depforge.core.metrics.GitMetrics;
import com.depforge.core.process.BailOutException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Adds submodules on a dedicated thread so that slow network operations do not hold up
 * the threads running build tasks.
 *
 * <p>Any thread may {@link #queue(SubmoduleRequest)}. The worker sleeps until woken,
 * takes the whole pending queue in one swap, releases the lock and then runs the
 * requests one at a time, in queue order. Requests queued while a batch runs wait for
 * the next batch.
 *
 * <p>{@link #stop()} is cooperative: the running request finishes, the rest of its
 * batch is dropped. A request that bails out ends the worker without affecting the
 * callers, which have already returned from {@code queue()}.
 */
@Component
public class SubmoduleAdder {

    private static final Logger log = LoggerFactory.getLogger(SubmoduleAdder.class);

    static final String CONTEXT = "submodule_adder";

    private final GitRuntime runtime;
    private final GitMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();
    private final Condition idle = lock.newCondition();

    /** Guarded by {@link #lock}. */
    private List<SubmoduleRequest> queue = new ArrayList<>();

    /** Set by queue() and stop(), guarded by {@link #lock}. */
    private boolean ready;

    /** True while a batch runs, guarded by {@link #lock}. */
    private boolean busy;

    /** True unless a worker thread is running, guarded by {@link #lock}. */
    private boolean exited = true;

    private volatile boolean quit;
    private volatile Thread thread;

    @Autowired
    public SubmoduleAdder(GitRuntime runtime, @Autowired(required = false) GitMetrics metrics) {
        this.runtime = runtime;
        this.metrics = metrics;
        if (metrics != null) {
            metrics.registerQueueDepth(this::pending);
        }
    }

    public SubmoduleAdder(GitRuntime runtime) {
        this(runtime, null);
    }

    /**
     * Starts the worker thread; no-op if it is already running.
     */
    @PostConstruct
    public synchronized void start() {
        if (thread != null && thread.isAlive()) {
            return;
        }
        quit = false;
        lock.lock();
        try {
            exited = false;
        } finally {
            lock.unlock();
        }
        thread = new Thread(this::threadMain, "submodule-adder");
        thread.setDaemon(true);
        thread.start();
        log.debug("{} started", CONTEXT);
    }

    public void queue(SubmoduleRequest request) {
        lock.lock();
        try {
            queue.add(request);
            ready = true;
            wake.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asks the worker to exit after the request it is running, if any. Does not wait.
     */
    public void stop() {
        quit = true;
        lock.lock();
        try {
            ready = true;
            wake.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the worker thread to exit.
     */
    public void join() {
        Thread t;
        synchronized (this) {
            t = thread;
        }
        if (t == null) {
            return;
        }
        try {
            t.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} to stop", CONTEXT);
        }
    }

    /**
     * Blocks until the queue is empty and no request is running, or the worker has
     * exited.
     */
    public void awaitIdle() {
        lock.lock();
        try {
            while ((busy || !queue.isEmpty()) && !exited) {
                idle.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} to finish", CONTEXT);
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void close() {
        stop();
        join();
        log.debug("{} stopped", CONTEXT);
    }

    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public int pending() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private void threadMain() {
        MdcContext.setTask(CONTEXT);
        try {
            while (!quit) {
                List<SubmoduleRequest> batch;

                lock.lock();
                try {
                    while (!ready) {
                        wake.await();
                    }
                    ready = false;

                    if (quit) {
                        break;
                    }

                    batch = queue;
                    queue = new ArrayList<>();
                    busy = true;
                } finally {
                    lock.unlock();
                }

                process(batch);
                markIdle();
            }
        } catch (BailOutException e) {
            log.debug("{} stopped after a failed submodule: {}", CONTEXT, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("{} stopped on an unexpected error", CONTEXT, e);
        } finally {
            MdcContext.clear();
            markExited();
        }
    }

    private void markExited() {
        lock.lock();
        try {
            busy = false;
            exited = true;
            idle.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void markIdle() {
        lock.lock();
        try {
            busy = false;
            idle.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void process(List<SubmoduleRequest> batch) {
        log.trace("{}: woke up, {} to process", CONTEXT, batch.size());

        for (var request : batch) {
            log.trace("{}: running {}", CONTEXT, request.submodule());

            try {
                new GitSubmoduleTool(runtime, request).run();
                recordMetric(true);
            } catch (BailOutException e) {
                recordMetric(false);
                throw e;
            }

            if (quit) {
                break;
            }
        }
    }

    private void recordMetric(boolean success) {
        if (metrics != null) {
            metrics.recordSubmodule(success);
        }
    }
}
