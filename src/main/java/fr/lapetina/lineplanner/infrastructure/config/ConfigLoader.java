package fr.lapetina.lineplanner.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * YAML configuration loader.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of layout values before a configuration is accepted
 * - Reload on demand or on file modification
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<LinePlannerConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
    }

    /**
     * Loads, validates and publishes the configuration.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public LinePlannerConfig load() {
        return publish(read());
    }

    /**
     * Loads a configuration from a stream without touching the configured path.
     */
    public LinePlannerConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    public LinePlannerConfig getCurrentConfig() {
        return currentConfig.get();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Reloads the configuration, keeping the current one if the new one is rejected.
     */
    public LinePlannerConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    private LinePlannerConfig publish(LinePlannerConfig config) {
        try {
            config.toLayoutSettings();
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
        LinePlannerConfig previous = currentConfig.getAndSet(config);
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
        return config;
    }

    private LinePlannerConfig read() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                lastModified = Files.getLastModifiedTime(configPath).toMillis();
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration from: " + configPath, e);
            }
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Configuration file not found: " + configPath);
            }
            log.info("Loading configuration from classpath: {}", resource);
            return parse(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + resource, e);
        }
    }

    private static LinePlannerConfig parse(InputStream inputStream, String origin) {
        Yaml yaml = new Yaml(new Constructor(LinePlannerConfig.class, new LoaderOptions()));
        try {
            LinePlannerConfig config = yaml.load(inputStream);
            // An empty document yields null; fall back to defaults
            return config != null ? config : new LinePlannerConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + origin + ": " + e.getMessage(), e);
        }
    }

    /**
     * Starts polling the configuration file for modifications.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });
            watchExecutor.scheduleWithFixedDelay(this::pollForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);
        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void pollForChanges() {
        WatchKey key = watchService.poll();
        if (key == null) {
            return;
        }
        try {
            for (WatchEvent<?> event : key.pollEvents()) {
                if (configPath.getFileName().equals(event.context()) && isNewer()) {
                    log.info("Configuration file changed, reloading...");
                    reload();
                }
            }
        } catch (IOException | RuntimeException e) {
            log.error("Error checking for config changes", e);
        } finally {
            key.reset();
        }
    }

    private boolean isNewer() throws IOException {
        return Files.getLastModifiedTime(configPath).toMillis() > lastModified;
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
