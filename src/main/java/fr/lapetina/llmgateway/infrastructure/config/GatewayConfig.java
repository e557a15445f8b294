package fr.lapetina.llmgateway.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML.
 */
public class GatewayConfig {

    private ServerConfig server = new ServerConfig();
    private List<ModelEntry> models = new ArrayList<>();
    private Map<String, PriceEntry> prices = new LinkedHashMap<>();
    private RoutingConfig routing = new RoutingConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private StatsConfig stats = new StatsConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ModelEntry> getModels() { return models; }
    public void setModels(List<ModelEntry> models) { this.models = models; }

    /**
     * Prices keyed by model id, or by provider id to price a whole family.
     */
    public Map<String, PriceEntry> getPrices() { return prices; }
    public void setPrices(Map<String, PriceEntry> prices) { this.prices = prices; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public StatsConfig getStats() { return stats; }
    public void setStats(StatsConfig stats) { this.stats = stats; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Models used when the configuration names none.
     */
    public static List<ModelEntry> defaultModels() {
        List<ModelEntry> defaults = new ArrayList<>();
        defaults.add(ModelEntry.of("deepseek-chat", "deepseek", "deepseek-chat", 1, List.of("chat", "reasoning")));
        defaults.add(ModelEntry.of("gpt-4o-mini", "openai", "gpt-4o-mini", 2, List.of("chat")));
        defaults.add(ModelEntry.of("claude-3-5-sonnet", "anthropic", "claude-3-5-sonnet-20241022", 3,
                List.of("chat", "vision", "function_calling")));
        return defaults;
    }

    /**
     * Prices of the default models, in USD per one million tokens.
     */
    public static Map<String, PriceEntry> defaultPrices() {
        Map<String, PriceEntry> defaults = new LinkedHashMap<>();
        defaults.put("deepseek-chat", PriceEntry.of(0.5, 2.0));
        defaults.put("gpt-4o-mini", PriceEntry.of(0.15, 0.6));
        defaults.put("claude-3-5-sonnet", PriceEntry.of(3.0, 15.0));
        return defaults;
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Individual model configuration. {@code apiKey} is optional: when absent
     * the key is looked up in the credential store by provider id.
     */
    public static class ModelEntry {
        private String id;
        private String provider;
        private String modelName;
        private String apiKey;
        private String baseUrl;
        private int priority = 100;
        private boolean enabled = true;
        private List<String> capabilities = new ArrayList<>(List.of("chat"));
        private Integer maxTokens;
        private Double temperature;
        private Integer contextLength;
        private String displayName;

        static ModelEntry of(String id, String provider, String modelName, int priority, List<String> capabilities) {
            ModelEntry entry = new ModelEntry();
            entry.setId(id);
            entry.setProvider(provider);
            entry.setModelName(modelName);
            entry.setPriority(priority);
            entry.setCapabilities(new ArrayList<>(capabilities));
            return entry;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModelName() { return modelName; }
        public void setModelName(String modelName) { this.modelName = modelName; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }

        public Integer getMaxTokens() { return maxTokens; }
        public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }

        public Integer getContextLength() { return contextLength; }
        public void setContextLength(Integer contextLength) { this.contextLength = contextLength; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
    }

    /**
     * Token price in USD per one million tokens.
     */
    public static class PriceEntry {
        private double input;
        private double output;

        static PriceEntry of(double input, double output) {
            PriceEntry entry = new PriceEntry();
            entry.setInput(input);
            entry.setOutput(output);
            return entry;
        }

        public double getInput() { return input; }
        public void setInput(double input) { this.input = input; }

        public double getOutput() { return output; }
        public void setOutput(double output) { this.output = output; }
    }

    /**
     * Routing configuration.
     */
    public static class RoutingConfig {
        private String defaultStrategy = "smart";

        public String getDefaultStrategy() { return defaultStrategy; }
        public void setDefaultStrategy(String defaultStrategy) { this.defaultStrategy = defaultStrategy; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long requestTimeoutMs = 5000;
        private long connectTimeoutMs = 3000;
        private long checkTimeoutMs = 5000;
        private long streamTimeoutMs = 120000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getCheckTimeoutMs() { return checkTimeoutMs; }
        public void setCheckTimeoutMs(long checkTimeoutMs) { this.checkTimeoutMs = checkTimeoutMs; }

        public long getStreamTimeoutMs() { return streamTimeoutMs; }
        public void setStreamTimeoutMs(long streamTimeoutMs) { this.streamTimeoutMs = streamTimeoutMs; }
    }

    /**
     * Statistics configuration.
     */
    public static class StatsConfig {
        private int windowSize = 20;

        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
    }

    /**
     * Periodic check configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = false;
        private long intervalMs = 60000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
