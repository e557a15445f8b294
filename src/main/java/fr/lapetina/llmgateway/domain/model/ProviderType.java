package fr.lapetina.llmgateway.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Provider families the gateway can dispatch to.
 *
 * Each family carries its public API endpoint, used when a model
 * configuration does not override the base URL.
 */
public enum ProviderType {
    DEEPSEEK("deepseek", "https://api.deepseek.com/v1"),
    OPENAI("openai", "https://api.openai.com/v1"),
    ANTHROPIC("anthropic", "https://api.anthropic.com/v1"),
    ZHIPU("zhipu", "https://open.bigmodel.cn/api/paas/v4"),
    QWEN("qwen", "https://dashscope.aliyuncs.com/compatible-mode/v1"),
    MOONSHOT("moonshot", "https://api.moonshot.cn/v1");

    private final String id;
    private final String defaultBaseUrl;

    ProviderType(String id, String defaultBaseUrl) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
    }

    /**
     * Returns the lowercase identifier used in configuration and credential lookup.
     */
    public String id() {
        return id;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    /**
     * Resolves a provider by its configuration identifier, case-insensitively.
     */
    public static Optional<ProviderType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
