package fr.lapetina.lineplanner.infrastructure.metrics;

import fr.lapetina.lineplanner.domain.model.LayoutErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Layout engine metrics on Micrometer, exposed in Prometheus format.
 *
 * Provides:
 * - Generation latency timer
 * - Layout counters by outcome
 * - Error counters by type
 * - Machines-per-layout distribution
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final Timer generationTimer;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final DistributionSummary machinesPerLayout;
    private final Map<LayoutErrorType, Counter> errorCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.generationTimer = Timer.builder(prefix + "_layout_generation")
                .description("Layout generation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.successCounter = Counter.builder(prefix + "_layouts_total")
                .description("Layouts generated")
                .tag("outcome", "success")
                .register(registry);

        this.failureCounter = Counter.builder(prefix + "_layouts_total")
                .description("Layouts generated")
                .tag("outcome", "failure")
                .register(registry);

        this.machinesPerLayout = DistributionSummary.builder(prefix + "_machines_per_layout")
                .description("Machine instances placed per layout")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("line_planner");
    }

    /**
     * Records a successful generation.
     */
    public void recordLayout(Duration elapsed, int machines) {
        generationTimer.record(elapsed);
        successCounter.increment();
        machinesPerLayout.record(machines);
    }

    /**
     * Records a failed generation.
     */
    public void recordFailure(LayoutErrorType errorType) {
        failureCounter.increment();
        errorCounters.computeIfAbsent(errorType, type ->
                Counter.builder(prefix + "_errors_total")
                        .description("Layout generation errors")
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    public double getLayoutCount() {
        return successCounter.count();
    }

    public double getFailureCount() {
        return failureCounter.count();
    }

    public double getErrorCount(LayoutErrorType errorType) {
        Counter counter = errorCounters.get(errorType);
        return counter != null ? counter.count() : 0;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
