package fr.lapetina.lineplanner;

import fr.lapetina.lineplanner.domain.placement.LayoutSettings;
import fr.lapetina.lineplanner.engine.LayoutGenerator;
import fr.lapetina.lineplanner.infrastructure.config.ConfigLoader;
import fr.lapetina.lineplanner.infrastructure.config.LinePlannerConfig;
import fr.lapetina.lineplanner.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Factory for a fully-wired {@link LayoutGenerator} built from configuration.
 * The generator is rebuilt whenever the configuration is reloaded.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LinePlannerFactory factory = LinePlannerFactory.create("config.yaml")) {
 *     List<PlacedEntity> layout = factory.getGenerator().generate(operations, 1200, 480);
 * }
 * }</pre>
 */
public class LinePlannerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LinePlannerFactory.class);

    private final ConfigLoader configLoader;
    private final MetricsRegistry metricsRegistry;
    private final AtomicReference<LinePlannerConfig> config = new AtomicReference<>();
    private final AtomicReference<LayoutGenerator> generator = new AtomicReference<>();

    protected LinePlannerFactory(String configPath) {
        log.info("Initializing LinePlannerFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        LinePlannerConfig initial = configLoader.load();

        this.metricsRegistry = initial.getMetrics().isEnabled()
                ? new MetricsRegistry(initial.getMetrics().getPrefix())
                : null;

        apply(initial);
        configLoader.addListener(this::onConfigChanged);

        log.info("LinePlannerFactory initialized");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static LinePlannerFactory create(String configPath) {
        return new LinePlannerFactory(configPath);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static LinePlannerFactory create() {
        return create("config.yaml");
    }

    /**
     * Enables hot reload of the configuration file.
     */
    public LinePlannerFactory start() {
        configLoader.startWatching();
        return this;
    }

    public LayoutGenerator getGenerator() {
        return generator.get();
    }

    public LinePlannerConfig getConfig() {
        return config.get();
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    private void onConfigChanged(LinePlannerConfig oldConfig, LinePlannerConfig newConfig) {
        log.info("Configuration changed, rebuilding layout generator");
        apply(newConfig);
    }

    private void apply(LinePlannerConfig newConfig) {
        LayoutSettings settings = newConfig.toLayoutSettings();
        config.set(newConfig);
        generator.set(new LayoutGenerator(settings, metricsRegistry));
        log.info("Layout settings applied: machinePitch={}, sectionGap={}, transitionFixtures={}",
                settings.spacing().machinePitch(), settings.spacing().sectionGap(),
                settings.transitionFixtures());
    }

    @Override
    public void close() {
        configLoader.close();
        if (metricsRegistry != null) {
            metricsRegistry.close();
        }
    }
}
