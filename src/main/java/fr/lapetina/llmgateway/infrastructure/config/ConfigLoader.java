package fr.lapetina.llmgateway.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Configuration loader.
 *
 * Looks for the file on the file system first, then on the classpath. When
 * neither exists, or the loaded configuration names no model, the default
 * model set applies.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(GatewayConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration, with defaults applied
     * @throws ConfigurationException if the file exists but cannot be read or parsed
     */
    public GatewayConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        log.warn("Configuration file not found, using default models: {}", configPath);
        return applyDefaults(createDefault());
    }

    /**
     * Loads configuration from an input stream.
     */
    public GatewayConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private GatewayConfig parse(InputStream inputStream, String source) {
        GatewayConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            log.warn("Configuration is empty, using defaults: source={}", source);
            config = createDefault();
        }
        return applyDefaults(config);
    }

    private static GatewayConfig applyDefaults(GatewayConfig config) {
        if (config.getServer() == null) {
            config.setServer(new GatewayConfig.ServerConfig());
        }
        if (config.getRouting() == null) {
            config.setRouting(new GatewayConfig.RoutingConfig());
        }
        if (config.getTimeouts() == null) {
            config.setTimeouts(new GatewayConfig.TimeoutsConfig());
        }
        if (config.getStats() == null) {
            config.setStats(new GatewayConfig.StatsConfig());
        }
        if (config.getHealthCheck() == null) {
            config.setHealthCheck(new GatewayConfig.HealthCheckConfig());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(new GatewayConfig.MetricsConfig());
        }
        if (config.getPrices() == null) {
            config.setPrices(new LinkedHashMap<>());
        }
        if (config.getModels() == null || config.getModels().isEmpty()) {
            log.info("No models configured, using default model set");
            config.setModels(new ArrayList<>(GatewayConfig.defaultModels()));
            if (config.getPrices().isEmpty()) {
                config.setPrices(GatewayConfig.defaultPrices());
            }
        }
        return config;
    }

    /**
     * Creates a default configuration.
     */
    public static GatewayConfig createDefault() {
        return new GatewayConfig();
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
