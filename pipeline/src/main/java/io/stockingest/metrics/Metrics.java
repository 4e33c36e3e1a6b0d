package io.stockingest.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.codahale.metrics.Timer;
import org.slf4j.Logger;

import java.util.concurrent.TimeUnit;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public long count(String counterName) { return registry.counter(counterName).getCount(); }

    /** Writes a one-off snapshot of every metric to the given logger. */
    public void reportTo(Logger logger) {
        try (Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(logger)
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build()) {
            reporter.report();
        }
    }
}
