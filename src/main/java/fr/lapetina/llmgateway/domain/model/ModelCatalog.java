package fr.lapetina.llmgateway.domain.model;

import java.util.Map;
import java.util.Optional;

/**
 * Display names and context windows of well-known models.
 *
 * Used to fill metadata a configuration entry leaves out. Lookup is by
 * exact model id or provider model name.
 */
public final class ModelCatalog {

    private static final Map<String, Metadata> KNOWN = Map.ofEntries(
            Map.entry("deepseek-chat", new Metadata("DeepSeek Chat", 128_000)),
            Map.entry("deepseek-coder", new Metadata("DeepSeek Coder", 128_000)),
            Map.entry("gpt-4o", new Metadata("GPT-4o", 128_000)),
            Map.entry("gpt-4o-mini", new Metadata("GPT-4o Mini", 128_000)),
            Map.entry("o1", new Metadata("OpenAI o1", 200_000)),
            Map.entry("o1-mini", new Metadata("OpenAI o1-mini", 128_000)),
            Map.entry("claude-3-5-sonnet", new Metadata("Claude 3.5 Sonnet", 200_000)),
            Map.entry("claude-3-opus", new Metadata("Claude 3 Opus", 200_000)),
            Map.entry("glm-4", new Metadata("GLM-4", 128_000)),
            Map.entry("glm-4-flash", new Metadata("GLM-4 Flash", 128_000)),
            Map.entry("qwen-turbo", new Metadata("Qwen Turbo", 100_000)),
            Map.entry("qwen-plus", new Metadata("Qwen Plus", 100_000)));

    private ModelCatalog() {
    }

    public static Optional<Metadata> lookup(String modelId, String modelName) {
        Metadata byId = modelId == null ? null : KNOWN.get(modelId);
        if (byId != null) {
            return Optional.of(byId);
        }
        return Optional.ofNullable(modelName == null ? null : KNOWN.get(modelName));
    }

    public record Metadata(String displayName, int contextLength) {
    }
}
