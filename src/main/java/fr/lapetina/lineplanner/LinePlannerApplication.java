package fr.lapetina.lineplanner;

import fr.lapetina.lineplanner.api.HttpServer;
import fr.lapetina.lineplanner.infrastructure.config.LinePlannerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Line Planner service.
 */
public class LinePlannerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LinePlannerApplication.class);

    private final LinePlannerFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public LinePlannerApplication(String configPath) throws IOException {
        log.info("Starting Line Planner...");

        this.factory = LinePlannerFactory.create(configPath).start();

        LinePlannerConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getWorkerThreads(),
                factory
        );

        log.info("Line Planner initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Line Planner started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public LinePlannerFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down Line Planner...");

        try {
            httpServer.close();
        } catch (RuntimeException e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (RuntimeException e) {
            log.warn("Error closing factory", e);
        }

        log.info("Line Planner shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            LinePlannerApplication app = new LinePlannerApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Failed to start Line Planner", e);
            System.exit(1);
        }
    }
}
