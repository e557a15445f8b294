package fr.lapetina.llmgateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.llmgateway.domain.model.ModelCapability;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.infrastructure.config.GatewayConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Model as exposed by the models endpoints.
 *
 * {@code api_key} is accepted on input and never written back: responses
 * only tell whether a key is configured.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiModel {

    private String id;
    private String provider;

    @JsonProperty("model_name")
    private String modelName;

    @JsonProperty(value = "api_key", access = JsonProperty.Access.WRITE_ONLY)
    private String apiKey;

    @JsonProperty(value = "has_api_key", access = JsonProperty.Access.READ_ONLY)
    private Boolean hasApiKey;

    @JsonProperty("base_url")
    private String baseUrl;

    private Integer priority;
    private Boolean enabled;
    private List<String> capabilities;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    private Double temperature;

    @JsonProperty("context_length")
    private Integer contextLength;

    @JsonProperty("display_name")
    private String displayName;

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getModelName() { return modelName; }
    public void setModelName(String modelName) { this.modelName = modelName; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Boolean getHasApiKey() { return hasApiKey; }
    public void setHasApiKey(Boolean hasApiKey) { this.hasApiKey = hasApiKey; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public Integer getPriority() { return priority; }
    public void setPriority(Integer priority) { this.priority = priority; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }

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

    /**
     * Creates the API view of a model, without its key.
     */
    public static ApiModel fromConfig(ModelConfig config) {
        ApiModel api = new ApiModel();
        api.setId(config.getId());
        api.setProvider(config.getProvider().id());
        api.setModelName(config.getModelName());
        api.setHasApiKey(config.getApiKey().isPresent());
        api.setBaseUrl(config.getEffectiveBaseUrl().toString());
        api.setPriority(config.getPriority());
        api.setEnabled(config.isEnabled());
        api.setCapabilities(config.getCapabilities().stream().map(ModelCapability::tag).toList());
        api.setMaxTokens(config.getMaxTokens());
        api.setTemperature(config.getTemperature());
        api.setContextLength(config.getContextLength());
        api.setDisplayName(config.getDisplayName());
        return api;
    }

    /**
     * Converts to a configuration entry, applying configuration defaults to absent fields.
     */
    public GatewayConfig.ModelEntry toModelEntry() {
        GatewayConfig.ModelEntry entry = new GatewayConfig.ModelEntry();
        entry.setId(id);
        entry.setProvider(provider);
        entry.setModelName(modelName);
        entry.setApiKey(apiKey);
        entry.setBaseUrl(baseUrl);
        if (priority != null) {
            entry.setPriority(priority);
        }
        if (enabled != null) {
            entry.setEnabled(enabled);
        }
        if (capabilities != null) {
            entry.setCapabilities(new ArrayList<>(capabilities));
        }
        entry.setMaxTokens(maxTokens);
        entry.setTemperature(temperature);
        entry.setContextLength(contextLength);
        entry.setDisplayName(displayName);
        return entry;
    }
}
