package io.floorsheet.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Adds n to the named counter; non-positive n leaves it untouched. */
    public void count(String name, long n) {
        if (n > 0) registry.counter(name).inc(n);
    }

    public long countOf(String name) {
        Counter c = registry.getCounters().get(name);
        return c == null ? 0L : c.getCount();
    }
}
