package fr.lapetina.llmgateway.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmgateway.domain.model.ChatMessage;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ProviderErrorType;
import fr.lapetina.llmgateway.domain.model.ProviderRequest;
import fr.lapetina.llmgateway.domain.model.TokenUsage;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Adapter for the Anthropic Messages API.
 *
 * System messages are not part of the conversation there: they are joined
 * into the top-level {@code system} field. The conversation only knows user
 * and assistant turns, so tool output is sent as a user turn.
 * {@code max_tokens} is mandatory.
 */
public final class AnthropicAdapter extends AbstractHttpProviderAdapter {

    public static final String API_VERSION = "2023-06-01";
    static final int DEFAULT_MAX_TOKENS = 1024;
    static final String TOOL_RESULT_PREFIX = "Tool result:\n";

    public AnthropicAdapter(
            ModelConfig config,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Duration requestTimeout
    ) {
        super(config, httpClient, objectMapper, requestTimeout);
    }

    @Override
    protected String completionPath() {
        return "/messages";
    }

    @Override
    protected Object buildBody(ProviderRequest request, boolean stream) {
        StringJoiner system = new StringJoiner("\n\n");
        List<Map<String, String>> messages = new ArrayList<>();
        for (ChatMessage message : request.messages()) {
            if (message.isSystem()) {
                system.add(message.content());
            } else if (message.isTool()) {
                messages.add(Map.of("role", ChatMessage.USER, "content", TOOL_RESULT_PREFIX + message.content()));
            } else {
                messages.add(Map.of("role", message.role(), "content", message.content()));
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModelName());
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : DEFAULT_MAX_TOKENS);
        if (system.length() > 0) {
            body.put("system", system.toString());
        }
        body.put("messages", messages);
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    @Override
    protected void addAuthHeaders(HttpRequest.Builder builder, String apiKey) {
        builder.header("x-api-key", apiKey);
        builder.header("anthropic-version", API_VERSION);
    }

    @Override
    protected ParsedCompletion parseCompletion(JsonNode body) {
        JsonNode blocks = body.path("content");
        if (!blocks.isArray()) {
            throw new MalformedResponseException("missing content array");
        }
        StringBuilder text = new StringBuilder();
        boolean found = false;
        for (JsonNode block : blocks) {
            if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                text.append(block.path("text").asText());
                found = true;
            }
        }
        if (!found) {
            throw new MalformedResponseException("no text block in content");
        }
        JsonNode usage = body.path("usage");
        return new ParsedCompletion(
                text.toString(),
                new TokenUsage(tokens(usage, "input_tokens"), tokens(usage, "output_tokens"))
        );
    }

    @Override
    protected void onStreamEvent(JsonNode event, StreamState state) {
        String type = event.path("type").asText();
        switch (type) {
            case "message_start" -> {
                JsonNode usage = event.path("message").path("usage");
                state.promptTokens(tokens(usage, "input_tokens"));
                state.completionTokens(tokens(usage, "output_tokens"));
            }
            case "content_block_delta" -> {
                JsonNode delta = event.path("delta");
                if ("text_delta".equals(delta.path("type").asText())) {
                    state.delta(delta.path("text").asText());
                }
            }
            // output_tokens is cumulative
            case "message_delta" -> state.completionTokens(tokens(event.path("usage"), "output_tokens"));
            case "message_stop" -> state.done();
            case "error" -> {
                JsonNode error = event.path("error");
                throw new StreamFailureException(classifyStreamError(error.path("type").asText()),
                        error.path("message").asText("stream error"));
            }
            // ping, content block boundaries and event types added later carry no text
            default -> {
            }
        }
    }

    static ProviderErrorType classifyStreamError(String errorType) {
        return switch (errorType) {
            case "authentication_error", "permission_error" -> ProviderErrorType.AUTH_ERROR;
            case "rate_limit_error" -> ProviderErrorType.RATE_LIMITED;
            default -> ProviderErrorType.SERVER_ERROR;
        };
    }
}
