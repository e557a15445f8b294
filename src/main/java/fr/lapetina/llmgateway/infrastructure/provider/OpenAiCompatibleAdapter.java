package fr.lapetina.llmgateway.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ProviderErrorType;
import fr.lapetina.llmgateway.domain.model.ProviderRequest;
import fr.lapetina.llmgateway.domain.model.TokenUsage;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for the OpenAI chat completions wire format.
 *
 * Also serves DeepSeek, Zhipu, Qwen and Moonshot, which expose the same
 * {@code /chat/completions} contract behind a bearer token. Streams end
 * with {@code data: [DONE]}; token usage comes in the last chunk when the
 * provider honors {@code stream_options.include_usage}.
 */
public final class OpenAiCompatibleAdapter extends AbstractHttpProviderAdapter {

    public OpenAiCompatibleAdapter(
            ModelConfig config,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Duration requestTimeout
    ) {
        super(config, httpClient, objectMapper, requestTimeout);
    }

    @Override
    protected String completionPath() {
        return "/chat/completions";
    }

    @Override
    protected Object buildBody(ProviderRequest request, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModelName());

        List<Map<String, String>> messages = request.messages().stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList();
        body.put("messages", messages);
        body.put("stream", stream);
        if (stream) {
            body.put("stream_options", Map.of("include_usage", true));
        }

        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            body.put("max_tokens", request.maxTokens());
        }
        return body;
    }

    @Override
    protected void addAuthHeaders(HttpRequest.Builder builder, String apiKey) {
        builder.header("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected ParsedCompletion parseCompletion(JsonNode body) {
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new MalformedResponseException("missing choices[0].message.content");
        }
        JsonNode usage = body.path("usage");
        return new ParsedCompletion(
                content.asText(),
                new TokenUsage(tokens(usage, "prompt_tokens"), tokens(usage, "completion_tokens"))
        );
    }

    @Override
    protected void onStreamEvent(JsonNode event, StreamState state) {
        JsonNode error = event.path("error");
        if (error.isObject()) {
            throw new StreamFailureException(ProviderErrorType.SERVER_ERROR,
                    error.path("message").asText("stream error"));
        }
        if (!event.has("choices") && !event.has("usage")) {
            throw new MalformedResponseException("chunk has neither choices nor usage");
        }

        JsonNode delta = event.path("choices").path(0).path("delta").path("content");
        if (delta.isTextual()) {
            state.delta(delta.asText());
        }
        JsonNode usage = event.path("usage");
        if (usage.isObject()) {
            state.promptTokens(tokens(usage, "prompt_tokens"));
            state.completionTokens(tokens(usage, "completion_tokens"));
        }
    }
}
