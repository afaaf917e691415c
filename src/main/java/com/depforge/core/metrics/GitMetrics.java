package com.depforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for git process runs and the submodule queue.
 */
@Service
public class GitMetrics {

    private final MeterRegistry registry;

    public GitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one finished process run.
     *
     * @param command the git subcommand, e.g. "clone"
     * @param success whether the process exited with code 0
     * @param ms      wall-clock time in milliseconds
     */
    public void recordInvocation(String command, boolean success, long ms) {
        String tag = command == null || command.isEmpty() ? "unknown" : command;

        Counter.builder("depforge.git.invocations")
                .tag("command", tag)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();

        Timer.builder("depforge.git.duration")
                .tag("command", tag)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSubmodule(boolean success) {
        Counter.builder("depforge.submodules.processed")
                .description("Submodule additions run by the background worker")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge reporting how many submodule requests are waiting.
     */
    public void registerQueueDepth(Supplier<Number> pending) {
        Gauge.builder("depforge.submodules.queued", pending)
                .description("Submodule requests waiting for the background worker")
                .register(registry);
    }
}
