package com.rpagent.lifecycle;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Micrometer meters of the coordinator: {@code rpagent.operations} counted by operation and
 * outcome, and {@code rpagent.plugin.launch} timing plugin starts by outcome.
 */
public final class LifecycleMetrics {

    static final String OPERATIONS = "rpagent.operations";
    static final String PLUGIN_LAUNCH = "rpagent.plugin.launch";

    private final MeterRegistry registry;

    public LifecycleMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics kept in an in-memory registry. */
    public static LifecycleMetrics inMemory() {
        return new LifecycleMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    void recordOperation(OperationType operation, String outcome) {
        registry.counter(OPERATIONS, "operation", operation.name(), "outcome", outcome).increment();
    }

    <T> T timeLaunch(Supplier<T> launch) {
        Timer.Sample sample = Timer.start(registry);
        String outcome = "failure";
        try {
            T result = launch.get();
            outcome = "success";
            return result;
        } finally {
            sample.stop(Timer.builder(PLUGIN_LAUNCH).tag("outcome", outcome).register(registry));
        }
    }

    /** Count of recorded operations with the given outcome. */
    public double operationCount(OperationType operation, String outcome) {
        return registry.counter(OPERATIONS, "operation", operation.name(), "outcome", outcome).count();
    }
}
