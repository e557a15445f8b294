package fr.lapetina.llmgateway;

import fr.lapetina.llmgateway.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the LLM Gateway.
 */
public class LlmGatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmGatewayApplication.class);

    private final GatewayFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public LlmGatewayApplication(GatewayFactory factory) throws Exception {
        log.info("Starting LLM Gateway...");

        this.factory = factory.start();

        // Create HTTP server
        this.httpServer = new HttpServer(
                factory.getConfig().getServer().getPort(),
                factory.getConfig().getServer().getBacklog(),
                factory.getGateway(),
                factory.getHealthChecker(),
                factory.getMetricsRegistry(),
                factory.getModelMapper(),
                factory.getDefaultStrategy()
        );

        log.info("LLM Gateway initialized");
    }

    public LlmGatewayApplication(String configPath) throws Exception {
        this(GatewayFactory.create(configPath));
    }

    public void start() {
        httpServer.start();
        log.info("LLM Gateway started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public GatewayFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down LLM Gateway...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("LLM Gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "gateway.yaml";

        try {
            LlmGatewayApplication app = new LlmGatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start LLM Gateway", e);
            System.exit(1);
        }
    }
}
