package fr.lapetina.lineplanner.infrastructure.config;

/**
 * Listener for configuration reloads.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a configuration has been loaded and validated.
     *
     * @param oldConfig the previous configuration (null on initial load)
     * @param newConfig the new configuration
     */
    void onConfigChanged(LinePlannerConfig oldConfig, LinePlannerConfig newConfig);
}
