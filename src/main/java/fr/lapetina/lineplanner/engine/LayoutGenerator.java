package fr.lapetina.lineplanner.engine;

import fr.lapetina.lineplanner.domain.balancing.CapacityPlanner;
import fr.lapetina.lineplanner.domain.exception.LayoutException;
import fr.lapetina.lineplanner.domain.grouping.SectionGrouper;
import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.Operation;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;
import fr.lapetina.lineplanner.domain.placement.LanePlacer;
import fr.lapetina.lineplanner.domain.placement.LayoutSettings;
import fr.lapetina.lineplanner.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point of the layout engine: balancing, grouping, then placement.
 *
 * <p>Usage:
 * <pre>{@code
 * LayoutGenerator generator = new LayoutGenerator(LayoutSettings.defaults());
 * List<PlacedEntity> layout = generator.generate(operations, 1200, 480);
 * }</pre>
 *
 * A failure in any stage aborts the whole call; no partial layout is
 * returned. The generator holds only immutable collaborators and is safe to
 * share between threads.
 */
public final class LayoutGenerator {

    private static final Logger log = LoggerFactory.getLogger(LayoutGenerator.class);

    private final LayoutSettings settings;
    private final CapacityPlanner planner;
    private final SectionGrouper grouper;
    private final LanePlacer placer;
    private final MetricsRegistry metrics;

    public LayoutGenerator(LayoutSettings settings) {
        this(settings, null);
    }

    /**
     * @param settings layout constants
     * @param metrics  metrics sink, may be null
     */
    public LayoutGenerator(LayoutSettings settings, MetricsRegistry metrics) {
        this.settings = settings;
        this.planner = new CapacityPlanner();
        this.grouper = new SectionGrouper();
        this.placer = new LanePlacer(settings);
        this.metrics = metrics;
    }

    /**
     * Generates the placed entities for a production target.
     *
     * @throws fr.lapetina.lineplanner.domain.exception.InvalidDemandException if the target or working time is not positive
     * @throws fr.lapetina.lineplanner.domain.exception.MalformedOperationException if an operation is malformed
     */
    public List<PlacedEntity> generate(
            List<Operation> operations,
            double targetOutputPerDay,
            double workingMinutesPerDay
    ) {
        return generateLayout(operations, targetOutputPerDay, workingMinutesPerDay).entities();
    }

    /**
     * Same as {@link #generate} but also returns the balancing step and a summary.
     */
    public GeneratedLayout generateLayout(
            List<Operation> operations,
            double targetOutputPerDay,
            double workingMinutesPerDay
    ) {
        String layoutId = UUID.randomUUID().toString();
        long startNanos = System.nanoTime();
        MDC.put("layoutId", layoutId);

        try {
            List<BalancedOperation> balanced = planner.plan(operations, targetOutputPerDay, workingMinutesPerDay);
            Map<String, List<BalancedOperation>> sections = grouper.group(balanced);
            List<PlacedEntity> entities = placer.place(sections);

            double taktTime = CapacityPlanner.taktTime(targetOutputPerDay, workingMinutesPerDay);
            LayoutSummary summary = LayoutSummary.of(balanced, taktTime, entities);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

            log.info("Layout generated: operations={}, sections={}, machines={}, fixtures={}, elapsedMs={}",
                    operations.size(), sections.size(), summary.totalMachines(),
                    summary.fixtures(), elapsed.toMillis());

            if (metrics != null) {
                metrics.recordLayout(elapsed, summary.totalMachines());
            }
            return new GeneratedLayout(layoutId, Instant.now(), balanced, entities, summary);

        } catch (LayoutException e) {
            log.warn("Layout generation failed: type={}, reason={}", e.getErrorType(), e.getMessage());
            if (metrics != null) {
                metrics.recordFailure(e.getErrorType());
            }
            throw e;
        } finally {
            MDC.remove("layoutId");
        }
    }

    /**
     * Runs only the balancing step.
     */
    public List<BalancedOperation> balance(
            List<Operation> operations,
            double targetOutputPerDay,
            double workingMinutesPerDay
    ) {
        return planner.plan(operations, targetOutputPerDay, workingMinutesPerDay);
    }

    public LayoutSettings getSettings() {
        return settings;
    }
}
