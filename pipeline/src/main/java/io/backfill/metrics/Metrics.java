package io.backfill.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String PREFIX = "backfill";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Counter counter(String name) { return registry.counter(MetricRegistry.name(PREFIX, name)); }
    public Timer timer(String name) { return registry.timer(MetricRegistry.name(PREFIX, name)); }
}
