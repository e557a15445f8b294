package fr.lapetina.llmgateway.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.llmgateway.domain.model.ChatMessage;
import fr.lapetina.llmgateway.domain.model.ModelCapability;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ProviderErrorType;
import fr.lapetina.llmgateway.domain.model.ProviderRequest;
import fr.lapetina.llmgateway.domain.model.ProviderResponse;
import fr.lapetina.llmgateway.domain.model.ProviderType;
import fr.lapetina.llmgateway.domain.model.TestResult;
import fr.lapetina.llmgateway.domain.model.TokenUsage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises both wire formats against a local stub server.
 */
class ProviderAdapterHttpTest {

    private HttpServer server;
    private HttpClient httpClient;
    private ObjectMapper objectMapper;
    private String baseUrl;

    private volatile int status;
    private volatile String responseBody;
    private volatile long delayMs;
    private final Map<String, String> capturedHeaders = new ConcurrentHashMap<>();
    private volatile String capturedPath;
    private volatile JsonNode capturedBody;

    @BeforeEach
    void setUp() throws IOException {
        objectMapper = ProviderAdapterFactory.createObjectMapper();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        status = 200;
        responseBody = "{}";
        delayMs = 0;

        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            capturedPath = exchange.getRequestURI().getPath();
            exchange.getRequestHeaders().forEach((name, values) ->
                    capturedHeaders.put(name.toLowerCase(), values.get(0)));
            capturedBody = objectMapper.readTree(exchange.getRequestBody());
            if (delayMs > 0) {
                TimeUnit.MILLISECONDS.sleep(delayMs);
            }
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            // client gave up
        } finally {
            exchange.close();
        }
    }

    private ModelConfig model(ProviderType provider, String apiKey) {
        return ModelConfig.builder()
                .id("stubbed")
                .provider(provider)
                .modelName("upstream-name")
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .addCapability(ModelCapability.CHAT)
                .build();
    }

    private ProviderResponse call(AbstractHttpProviderAdapter adapter, ProviderRequest request) {
        return adapter.complete(request).join();
    }

    private ProviderResponse stream(AbstractHttpProviderAdapter adapter, List<String> deltas) {
        return adapter.stream(conversation(), deltas::add).join();
    }

    private static String sse(String... events) {
        StringBuilder body = new StringBuilder();
        for (String event : events) {
            body.append(event).append("\n\n");
        }
        return body.toString();
    }

    private static ProviderRequest conversation() {
        return new ProviderRequest(List.of(
                ChatMessage.system("be brief"),
                ChatMessage.user("hello")), 0.3, 64);
    }

    @Nested
    @DisplayName("OpenAI-compatible wire format")
    class OpenAiTests {

        private OpenAiCompatibleAdapter adapter;

        @BeforeEach
        void createAdapter() {
            adapter = new OpenAiCompatibleAdapter(model(ProviderType.DEEPSEEK, "sk-test"),
                    httpClient, objectMapper, Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("should send a chat completions request and parse the answer")
        void shouldCompleteChat() {
            responseBody = """
                    {"id":"x","choices":[{"index":0,"message":{"role":"assistant","content":"Hi there"}}],
                     "usage":{"prompt_tokens":12,"completion_tokens":3,"total_tokens":15}}
                    """;

            ProviderResponse response = call(adapter, conversation());

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.content()).isEqualTo("Hi there");
            assertThat(response.usage()).isEqualTo(new TokenUsage(12, 3));

            assertThat(capturedPath).isEqualTo("/v1/chat/completions");
            assertThat(capturedHeaders).containsEntry("authorization", "Bearer sk-test");
            assertThat(capturedBody.path("model").asText()).isEqualTo("upstream-name");
            assertThat(capturedBody.path("stream").asBoolean()).isFalse();
            assertThat(capturedBody.path("max_tokens").asInt()).isEqualTo(64);
            assertThat(capturedBody.path("temperature").asDouble()).isEqualTo(0.3);
            assertThat(capturedBody.path("messages").size()).isEqualTo(2);
            assertThat(capturedBody.path("messages").path(0).path("role").asText()).isEqualTo("system");
        }

        @Test
        @DisplayName("should omit unset parameters")
        void shouldOmitUnsetParameters() {
            responseBody = "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}";

            ProviderResponse response = call(adapter, new ProviderRequest(List.of(ChatMessage.user("hi")), null, null));

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.usage()).isEqualTo(TokenUsage.EMPTY);
            assertThat(capturedBody.has("temperature")).isFalse();
            assertThat(capturedBody.has("max_tokens")).isFalse();
        }

        @Test
        @DisplayName("should report a body without choices as malformed")
        void shouldReportMalformedBody() {
            responseBody = "{\"object\":\"chat.completion\",\"choices\":[]}";

            ProviderResponse response = call(adapter, conversation());

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.MALFORMED_RESPONSE);
        }

        @Test
        @DisplayName("should report a non-JSON body as malformed")
        void shouldReportNonJsonBody() {
            responseBody = "<html>gateway</html>";

            ProviderResponse response = call(adapter, conversation());

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.MALFORMED_RESPONSE);
        }

        @Test
        @DisplayName("should classify HTTP errors and keep the provider message")
        void shouldClassifyHttpErrors() {
            status = 429;
            responseBody = "{\"error\":{\"message\":\"slow down\",\"type\":\"rate_limit\"}}";

            ProviderResponse response = call(adapter, conversation());

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.RATE_LIMITED);
            assertThat(response.errorMessage()).isEqualTo("HTTP 429: slow down");
        }

        @Test
        @DisplayName("should classify rejected credentials")
        void shouldClassifyAuthErrors() {
            status = 401;
            responseBody = "{\"error\":\"invalid key\"}";

            ProviderResponse response = call(adapter, conversation());

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.AUTH_ERROR);
            assertThat(response.errorMessage()).isEqualTo("HTTP 401: invalid key");
        }

        @Test
        @DisplayName("should classify server errors without a JSON body")
        void shouldClassifyServerErrors() {
            status = 503;
            responseBody = "upstream unavailable";

            ProviderResponse response = call(adapter, conversation());

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.SERVER_ERROR);
            assertThat(response.errorMessage()).isEqualTo("HTTP 503");
        }

        @Test
        @DisplayName("should time out slow providers")
        void shouldTimeOut() {
            delayMs = 1500;
            OpenAiCompatibleAdapter impatient = new OpenAiCompatibleAdapter(
                    model(ProviderType.OPENAI, "sk-test"), httpClient, objectMapper, Duration.ofMillis(200));

            ProviderResponse response = call(impatient, conversation());

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.TIMEOUT);
        }

        @Test
        @DisplayName("should fail without calling the provider when no key is configured")
        void shouldRequireApiKey() {
            OpenAiCompatibleAdapter keyless = new OpenAiCompatibleAdapter(
                    model(ProviderType.QWEN, null), httpClient, objectMapper, Duration.ofSeconds(2));

            ProviderResponse response = call(keyless, conversation());

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.AUTH_ERROR);
            assertThat(response.errorMessage()).contains("qwen");
            assertThat(capturedPath).isNull();
        }

        @Test
        @DisplayName("check should report success with latency")
        void checkShouldPass() {
            responseBody = "{\"choices\":[{\"message\":{\"content\":\"Hello\"}}]}";

            TestResult result = adapter.test().join();

            assertThat(result.success()).isTrue();
            assertThat(result.modelId()).isEqualTo("stubbed");
            assertThat(result.latencyMs()).isGreaterThanOrEqualTo(0);
            assertThat(capturedBody.path("max_tokens").asInt()).isEqualTo(8);
        }

        @Test
        @DisplayName("check should carry the error classification")
        void checkShouldFail() {
            status = 403;
            responseBody = "{}";

            TestResult result = adapter.test().join();

            assertThat(result.success()).isFalse();
            assertThat(result.errorMessage()).hasValue("AUTH_ERROR: HTTP 403");
        }
    }

    @Nested
    @DisplayName("Anthropic wire format")
    class AnthropicTests {

        private AnthropicAdapter adapter;

        @BeforeEach
        void createAdapter() {
            adapter = new AnthropicAdapter(model(ProviderType.ANTHROPIC, "ak-test"),
                    httpClient, objectMapper, Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("should lift system messages and parse text blocks")
        void shouldCompleteMessages() {
            responseBody = """
                    {"id":"msg_1","type":"message","role":"assistant",
                     "content":[{"type":"text","text":"Hello"},{"type":"text","text":" world"}],
                     "usage":{"input_tokens":20,"output_tokens":4}}
                    """;

            ProviderResponse response = call(adapter, conversation());

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.content()).isEqualTo("Hello world");
            assertThat(response.usage()).isEqualTo(new TokenUsage(20, 4));

            assertThat(capturedPath).isEqualTo("/v1/messages");
            assertThat(capturedHeaders).containsEntry("x-api-key", "ak-test");
            assertThat(capturedHeaders).containsEntry("anthropic-version", AnthropicAdapter.API_VERSION);
            assertThat(capturedHeaders).doesNotContainKey("authorization");
            assertThat(capturedBody.path("system").asText()).isEqualTo("be brief");
            assertThat(capturedBody.path("messages").size()).isEqualTo(1);
            assertThat(capturedBody.path("messages").path(0).path("role").asText()).isEqualTo("user");
        }

        @Test
        @DisplayName("should send tool results as user turns")
        void shouldMapToolMessagesToUserTurns() {
            responseBody = "{\"content\":[{\"type\":\"text\",\"text\":\"Sunny it is\"}]}";

            ProviderResponse response = call(adapter, new ProviderRequest(List.of(
                    ChatMessage.user("weather in Paris?"),
                    ChatMessage.assistant("calling the weather tool"),
                    new ChatMessage(ChatMessage.TOOL, "{\"sky\":\"clear\"}")), null, null));

            assertThat(response.isSuccess()).isTrue();
            JsonNode messages = capturedBody.path("messages");
            assertThat(messages.size()).isEqualTo(3);
            assertThat(messages.path(2).path("role").asText()).isEqualTo("user");
            assertThat(messages.path(2).path("content").asText())
                    .isEqualTo(AnthropicAdapter.TOOL_RESULT_PREFIX + "{\"sky\":\"clear\"}");
        }

        @Test
        @DisplayName("should always send max_tokens")
        void shouldDefaultMaxTokens() {
            responseBody = "{\"content\":[{\"type\":\"text\",\"text\":\"ok\"}]}";

            call(adapter, new ProviderRequest(List.of(ChatMessage.user("hi")), null, null));

            assertThat(capturedBody.path("max_tokens").asInt()).isEqualTo(AnthropicAdapter.DEFAULT_MAX_TOKENS);
            assertThat(capturedBody.has("system")).isFalse();
        }

        @Test
        @DisplayName("should report a body without text blocks as malformed")
        void shouldReportMissingText() {
            responseBody = "{\"content\":[{\"type\":\"tool_use\",\"id\":\"t1\"}]}";

            ProviderResponse response = call(adapter, conversation());

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.MALFORMED_RESPONSE);
        }
    }

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @Test
        @DisplayName("should map status codes to error types")
        void shouldMapStatusCodes() {
            assertThat(AbstractHttpProviderAdapter.classifyStatus(401)).isEqualTo(ProviderErrorType.AUTH_ERROR);
            assertThat(AbstractHttpProviderAdapter.classifyStatus(403)).isEqualTo(ProviderErrorType.AUTH_ERROR);
            assertThat(AbstractHttpProviderAdapter.classifyStatus(429)).isEqualTo(ProviderErrorType.RATE_LIMITED);
            assertThat(AbstractHttpProviderAdapter.classifyStatus(408)).isEqualTo(ProviderErrorType.TIMEOUT);
            assertThat(AbstractHttpProviderAdapter.classifyStatus(500)).isEqualTo(ProviderErrorType.SERVER_ERROR);
            assertThat(AbstractHttpProviderAdapter.classifyStatus(404)).isEqualTo(ProviderErrorType.SERVER_ERROR);
        }

        @Test
        @DisplayName("should map transport exceptions to error types")
        void shouldMapExceptions() {
            assertThat(AbstractHttpProviderAdapter.classifyException(new HttpTimeoutException("late")))
                    .isEqualTo(ProviderErrorType.TIMEOUT);
            assertThat(AbstractHttpProviderAdapter.classifyException(new TimeoutException()))
                    .isEqualTo(ProviderErrorType.TIMEOUT);
            assertThat(AbstractHttpProviderAdapter.classifyException(new IOException("refused")))
                    .isEqualTo(ProviderErrorType.SERVER_ERROR);
        }

        @Test
        @DisplayName("unreachable provider should be a server error")
        void unreachableProviderShouldFail() {
            ModelConfig unreachable = ModelConfig.builder()
                    .id("nowhere")
                    .provider(ProviderType.OPENAI)
                    .apiKey("sk")
                    .baseUrl("http://127.0.0.1:1/v1")
                    .addCapability(ModelCapability.CHAT)
                    .build();
            OpenAiCompatibleAdapter adapter = new OpenAiCompatibleAdapter(
                    unreachable, httpClient, objectMapper, Duration.ofSeconds(2));

            ProviderResponse response = adapter.complete(conversation()).join();

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.SERVER_ERROR);
            assertThat(response.modelId()).isEqualTo("nowhere");
        }
    }

    @Nested
    @DisplayName("Streaming")
    class StreamingTests {

        private final List<String> deltas = new CopyOnWriteArrayList<>();

        private OpenAiCompatibleAdapter openAi() {
            return new OpenAiCompatibleAdapter(model(ProviderType.DEEPSEEK, "sk-test"),
                    httpClient, objectMapper, Duration.ofSeconds(2));
        }

        private AnthropicAdapter anthropic() {
            return new AnthropicAdapter(model(ProviderType.ANTHROPIC, "ak-test"),
                    httpClient, objectMapper, Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("should forward OpenAI chunks and read the usage chunk")
        void shouldStreamOpenAiChunks() {
            responseBody = sse(
                    ": keep-alive",
                    "data: {\"choices\":[{\"index\":0,\"delta\":{\"role\":\"assistant\"}}]}",
                    "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Hi\"}}]}",
                    "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\" there\"}}]}",
                    "data: {\"choices\":[],\"usage\":{\"prompt_tokens\":9,\"completion_tokens\":2}}",
                    "data: [DONE]");

            ProviderResponse response = stream(openAi(), deltas);

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.content()).isEqualTo("Hi there");
            assertThat(response.usage()).isEqualTo(new TokenUsage(9, 2));
            assertThat(deltas).containsExactly("Hi", " there");

            assertThat(capturedHeaders).containsEntry("accept", "text/event-stream");
            assertThat(capturedBody.path("stream").asBoolean()).isTrue();
            assertThat(capturedBody.path("stream_options").path("include_usage").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should stop reading at [DONE]")
        void shouldStopAtDone() {
            responseBody = sse(
                    "data: {\"choices\":[{\"delta\":{\"content\":\"kept\"}}]}",
                    "data: [DONE]",
                    "data: {\"choices\":[{\"delta\":{\"content\":\"ignored\"}}]}");

            ProviderResponse response = stream(openAi(), deltas);

            assertThat(response.content()).isEqualTo("kept");
            assertThat(deltas).containsExactly("kept");
        }

        @Test
        @DisplayName("should report an error chunk after earlier deltas")
        void shouldReportOpenAiErrorChunk() {
            responseBody = sse(
                    "data: {\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}",
                    "data: {\"error\":{\"message\":\"overloaded\"}}");

            ProviderResponse response = stream(openAi(), deltas);

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.SERVER_ERROR);
            assertThat(response.errorMessage()).isEqualTo("overloaded");
            assertThat(deltas).containsExactly("partial");
        }

        @Test
        @DisplayName("should report non-JSON data as malformed")
        void shouldReportMalformedChunk() {
            responseBody = sse("data: not-json");

            ProviderResponse response = stream(openAi(), deltas);

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.MALFORMED_RESPONSE);
        }

        @Test
        @DisplayName("should report a stream without events as malformed")
        void shouldReportEmptyStream() {
            responseBody = sse(": nothing to see");

            ProviderResponse response = stream(openAi(), deltas);

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.MALFORMED_RESPONSE);
            assertThat(response.errorMessage()).contains("without events");
            assertThat(deltas).isEmpty();
        }

        @Test
        @DisplayName("should classify HTTP errors before the stream starts")
        void shouldClassifyStreamHttpErrors() {
            status = 429;
            responseBody = "{\"error\":{\"message\":\"slow down\"}}";

            ProviderResponse response = stream(openAi(), deltas);

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.RATE_LIMITED);
            assertThat(response.errorMessage()).isEqualTo("HTTP 429: slow down");
            assertThat(deltas).isEmpty();
        }

        @Test
        @DisplayName("should not open a stream without an API key")
        void shouldRequireApiKeyForStream() {
            OpenAiCompatibleAdapter keyless = new OpenAiCompatibleAdapter(
                    model(ProviderType.QWEN, null), httpClient, objectMapper, Duration.ofSeconds(2));

            ProviderResponse response = stream(keyless, deltas);

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.AUTH_ERROR);
            assertThat(capturedPath).isNull();
        }

        @Test
        @DisplayName("should forward Anthropic text deltas until message_stop")
        void shouldStreamAnthropicEvents() {
            responseBody = sse(
                    "event: message_start\ndata: {\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":20,\"output_tokens\":1}}}",
                    "event: content_block_start\ndata: {\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"\"}}",
                    "event: ping\ndata: {\"type\":\"ping\"}",
                    "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hello\"}}",
                    "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\" world\"}}",
                    "event: content_block_stop\ndata: {\"type\":\"content_block_stop\",\"index\":0}",
                    "event: message_delta\ndata: {\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"end_turn\"},\"usage\":{\"output_tokens\":5}}",
                    "event: message_stop\ndata: {\"type\":\"message_stop\"}",
                    "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"late\"}}");

            ProviderResponse response = stream(anthropic(), deltas);

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.content()).isEqualTo("Hello world");
            assertThat(response.usage()).isEqualTo(new TokenUsage(20, 5));
            assertThat(deltas).containsExactly("Hello", " world");
            assertThat(capturedPath).isEqualTo("/v1/messages");
            assertThat(capturedBody.path("stream").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should classify Anthropic error events")
        void shouldReportAnthropicErrorEvent() {
            responseBody = sse(
                    "event: message_start\ndata: {\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":3}}}",
                    "event: error\ndata: {\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}");

            ProviderResponse response = stream(anthropic(), deltas);

            assertThat(response.errorType()).isEqualTo(ProviderErrorType.SERVER_ERROR);
            assertThat(response.errorMessage()).isEqualTo("Overloaded");
            assertThat(AnthropicAdapter.classifyStreamError("rate_limit_error")).isEqualTo(ProviderErrorType.RATE_LIMITED);
            assertThat(AnthropicAdapter.classifyStreamError("authentication_error")).isEqualTo(ProviderErrorType.AUTH_ERROR);
        }
    }
}
