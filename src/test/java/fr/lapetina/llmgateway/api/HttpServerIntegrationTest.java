package fr.lapetina.llmgateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmgateway.LlmGatewayApplication;
import fr.lapetina.llmgateway.domain.model.ProviderErrorType;
import fr.lapetina.llmgateway.integration.TestGatewayFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the HTTP API of a running gateway backed by scripted adapters.
 */
class HttpServerIntegrationTest {

    private TestGatewayFactory factory;
    private LlmGatewayApplication application;
    private HttpClient client;
    private ObjectMapper objectMapper;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestGatewayFactory.create();
        application = new LlmGatewayApplication(factory);
        application.start();
        baseUrl = "http://localhost:" + application.getPort();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        objectMapper = new ObjectMapper();
    }

    @AfterEach
    void tearDown() {
        if (application != null) {
            application.close();
        }
    }

    private HttpResponse<String> send(String method, String path, String body) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json");
        if (body != null) {
            builder.method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return objectMapper.readTree(response.body());
    }

    @Nested
    @DisplayName("POST /v1/completions")
    class CompletionTests {

        @Test
        @DisplayName("should route with the configured default strategy")
        void shouldComplete() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/completions", "{\"prompt\":\"Say hello\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.path("model").asText()).isEqualTo("alpha");
            assertThat(body.path("provider").asText()).isEqualTo("openai");
            assertThat(body.path("content").asText()).isEqualTo("ok from alpha");
            assertThat(body.path("strategy").asText()).isEqualTo("priority");
            assertThat(body.path("ranked").size()).isEqualTo(2);
            assertThat(body.path("usage").path("total_tokens").asInt()).isEqualTo(15);
            assertThat(body.path("failover").size()).isZero();
        }

        @Test
        @DisplayName("should report recovered failures")
        void shouldReportFailover() throws Exception {
            factory.adapters().fail("alpha", ProviderErrorType.RATE_LIMITED);

            HttpResponse<String> response = send("POST", "/v1/completions", """
                    {"messages":[{"role":"user","content":"Hello"}],"strategy":"priority"}
                    """);

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.path("model").asText()).isEqualTo("beta");
            assertThat(body.path("failover").path(0).path("model").asText()).isEqualTo("alpha");
            assertThat(body.path("failover").path(0).path("error_type").asText()).isEqualTo("RATE_LIMITED");
        }

        @Test
        @DisplayName("should answer 502 with every failure when all candidates fail")
        void shouldReportAllFailures() throws Exception {
            factory.adapters()
                    .fail("alpha", ProviderErrorType.SERVER_ERROR)
                    .fail("beta", ProviderErrorType.AUTH_ERROR);

            HttpResponse<String> response = send("POST", "/v1/completions", "{\"prompt\":\"Hello\"}");

            assertThat(response.statusCode()).isEqualTo(502);
            JsonNode body = json(response);
            assertThat(body.path("error").asText()).startsWith("All 2 candidate(s) failed");
            assertThat(body.path("failures").size()).isEqualTo(2);
            assertThat(body.path("failures").path(1).path("error_type").asText()).isEqualTo("AUTH_ERROR");
        }

        @Test
        @DisplayName("should reject invalid requests with 400")
        void shouldRejectInvalidRequests() throws Exception {
            assertThat(send("POST", "/v1/completions", "{}").statusCode()).isEqualTo(400);
            assertThat(send("POST", "/v1/completions", "{not json").statusCode()).isEqualTo(400);
            assertThat(send("POST", "/v1/completions", "{\"prompt\":\"x\",\"strategy\":\"fastest\"}").statusCode())
                    .isEqualTo(400);
            assertThat(send("POST", "/v1/completions", "{\"prompt\":\"x\",\"max_tokens\":0}").statusCode())
                    .isEqualTo(400);
            assertThat(send("POST", "/v1/completions",
                    "{\"messages\":[{\"role\":\"narrator\",\"content\":\"x\"}]}").statusCode()).isEqualTo(400);
            assertThat(factory.adapters().calls()).isEmpty();
        }

        @Test
        @DisplayName("should answer 404 for a disabled explicit model")
        void shouldRejectDisabledModel() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/completions", "{\"prompt\":\"x\",\"model\":\"gamma\"}");

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(json(response).path("error").asText()).contains("gamma");
        }

        @Test
        @DisplayName("should answer 503 when no enabled model has the capability")
        void shouldReportNoEligibleModel() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/completions",
                    "{\"prompt\":\"x\",\"capabilities\":[\"vision\"]}");

            assertThat(response.statusCode()).isEqualTo(503);
        }

        @Test
        @DisplayName("should stream deltas as server-sent events")
        void shouldStreamCompletion() throws Exception {
            factory.adapters().streamChunks("alpha", "Hel", "lo");

            HttpResponse<String> response = send("POST", "/v1/completions", "{\"prompt\":\"Say hello\",\"stream\":true}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValue("text/event-stream");
            assertThat(response.body())
                    .contains("event: delta\ndata: {\"delta\":\"Hel\"}\n\n")
                    .contains("event: delta\ndata: {\"delta\":\"lo\"}\n\n")
                    .endsWith("data: [DONE]\n\n");

            String resultLine = response.body().lines()
                    .dropWhile(line -> !line.equals("event: result"))
                    .skip(1)
                    .findFirst()
                    .orElseThrow();
            JsonNode result = objectMapper.readTree(resultLine.substring("data: ".length()));
            assertThat(result.path("model").asText()).isEqualTo("alpha");
            assertThat(result.path("content").asText()).isEqualTo("Hello");
        }

        @Test
        @DisplayName("stream failing before the first delta should keep the status mapping")
        void shouldMapEarlyStreamFailure() throws Exception {
            factory.adapters().fail("alpha", ProviderErrorType.RATE_LIMITED);

            HttpResponse<String> response = send("POST", "/v1/completions", "{\"prompt\":\"x\",\"stream\":true}");

            assertThat(response.statusCode()).isEqualTo(502);
            JsonNode body = json(response);
            assertThat(body.path("failures").size()).isEqualTo(1);
            assertThat(body.path("failures").path(0).path("error_type").asText()).isEqualTo("RATE_LIMITED");
            assertThat(factory.adapters().calledModelIds()).containsExactly("alpha");
        }

        @Test
        @DisplayName("should reject other methods")
        void shouldRejectOtherMethods() throws Exception {
            assertThat(send("GET", "/v1/completions", null).statusCode()).isEqualTo(405);
        }

        @Test
        @DisplayName("should echo the request id")
        void shouldEchoRequestId() throws Exception {
            HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/v1/completions"))
                    .header("X-Request-ID", "req-42")
                    .POST(HttpRequest.BodyPublishers.ofString("{\"prompt\":\"hi\"}"))
                    .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.headers().firstValue("X-Request-ID")).hasValue("req-42");
        }
    }

    @Nested
    @DisplayName("Routing endpoints")
    class RoutingTests {

        @Test
        @DisplayName("route should explain the decision without dispatching")
        void routeShouldNotDispatch() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/route", "{\"prompt\":\"x\",\"strategy\":\"cost\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.path("strategy").asText()).isEqualTo("cost");
            assertThat(body.path("selected").asText()).isEqualTo("beta");
            assertThat(body.path("reason").asText()).startsWith("lowest price (1.50 USD per 1M tokens)");
            assertThat(factory.adapters().calls()).isEmpty();
        }

        @Test
        @DisplayName("benchmark should report every strategy")
        void benchmarkShouldReportEveryStrategy() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/benchmark", "{\"prompt\":\"compare\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.size()).isEqualTo(4);
            assertThat(body.path(0).path("strategy").asText()).isEqualTo("smart");
            for (JsonNode entry : body) {
                assertThat(entry.path("success").asBoolean()).isTrue();
            }
        }

        @Test
        @DisplayName("stats should reflect dispatched attempts")
        void statsShouldReflectAttempts() throws Exception {
            factory.adapters().fail("alpha", ProviderErrorType.TIMEOUT);
            send("POST", "/v1/completions", "{\"prompt\":\"x\"}");

            JsonNode body = json(send("GET", "/v1/stats", null));

            assertThat(body.path("alpha").path("failure").asLong()).isEqualTo(1);
            assertThat(body.path("alpha").path("error_rate").asDouble()).isEqualTo(1.0);
            assertThat(body.path("alpha").path("avg_latency_ms").isNull()).isTrue();
            assertThat(body.path("beta").path("success").asLong()).isEqualTo(1);
            assertThat(body.path("gamma").path("samples").asInt()).isZero();
        }
    }

    @Nested
    @DisplayName("Model management")
    class ModelTests {

        @Test
        @DisplayName("should list models without exposing keys")
        void shouldListModels() throws Exception {
            JsonNode all = json(send("GET", "/v1/models", null));
            JsonNode enabled = json(send("GET", "/v1/models?enabled=true", null));

            assertThat(all.size()).isEqualTo(3);
            assertThat(enabled.size()).isEqualTo(2);
            assertThat(all.path(0).path("has_api_key").asBoolean()).isTrue();
            assertThat(all.path(0).has("api_key")).isFalse();
            assertThat(all.path(0).path("model_name").asText()).isEqualTo("alpha-model");
        }

        @Test
        @DisplayName("should register, update and remove a model")
        void shouldManageModelLifecycle() throws Exception {
            HttpResponse<String> created = send("POST", "/v1/models", """
                    {"id":"delta","provider":"qwen","api_key":"sk-delta","priority":0,"capabilities":["chat","code"]}
                    """);
            assertThat(created.statusCode()).isEqualTo(201);
            assertThat(created.body()).doesNotContain("sk-delta");

            assertThat(send("POST", "/v1/models", "{\"id\":\"delta\",\"provider\":\"qwen\"}").statusCode())
                    .isEqualTo(400);

            JsonNode completion = json(send("POST", "/v1/completions", "{\"prompt\":\"x\"}"));
            assertThat(completion.path("model").asText()).isEqualTo("delta");

            JsonNode disabled = json(send("POST", "/v1/models/delta/disable", null));
            assertThat(disabled.path("enabled").asBoolean()).isFalse();

            assertThat(send("DELETE", "/v1/models/delta", null).statusCode()).isEqualTo(200);
            assertThat(send("GET", "/v1/models/delta", null).statusCode()).isEqualTo(404);
            assertThat(send("DELETE", "/v1/models/delta", null).statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should reject unknown providers")
        void shouldRejectUnknownProvider() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/models", "{\"id\":\"x\",\"provider\":\"cohere\"}");

            assertThat(response.statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should reject an invalid base URL with 400")
        void shouldRejectInvalidBaseUrl() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/models",
                    "{\"id\":\"x\",\"provider\":\"openai\",\"base_url\":\"http://bad host/v1\"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).path("error").asText()).contains("Invalid baseUrl");
            assertThat(send("GET", "/v1/models/x", null).statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should expose display name and context length")
        void shouldExposeMetadata() throws Exception {
            JsonNode created = json(send("POST", "/v1/models",
                    "{\"id\":\"mini\",\"provider\":\"openai\",\"model_name\":\"gpt-4o-mini\"}"));
            JsonNode custom = json(send("POST", "/v1/models",
                    "{\"id\":\"own\",\"provider\":\"openai\",\"display_name\":\"Own model\",\"context_length\":32000}"));

            assertThat(created.path("display_name").asText()).isEqualTo("GPT-4o Mini");
            assertThat(created.path("context_length").asInt()).isEqualTo(128_000);
            assertThat(custom.path("display_name").asText()).isEqualTo("Own model");
            assertThat(custom.path("context_length").asInt()).isEqualTo(32_000);
        }

        @Test
        @DisplayName("enabling a model should make it routable")
        void enableShouldMakeRoutable() throws Exception {
            JsonNode enabled = json(send("POST", "/v1/models/gamma/enable", null));
            assertThat(enabled.path("enabled").asBoolean()).isTrue();

            HttpResponse<String> response = send("POST", "/v1/completions",
                    "{\"prompt\":\"x\",\"capabilities\":[\"vision\"]}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).path("model").asText()).isEqualTo("gamma");
            assertThat(send("POST", "/v1/models/ghost/enable", null).statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should check one or every model")
        void shouldCheckModels() throws Exception {
            factory.adapters().fail("beta", ProviderErrorType.AUTH_ERROR);

            JsonNode all = json(send("POST", "/v1/models/test", null));
            JsonNode single = json(send("POST", "/v1/models/beta/test", null));

            assertThat(all.size()).isEqualTo(3);
            assertThat(all.path(0).path("success").asBoolean()).isTrue();
            assertThat(single.path("success").asBoolean()).isFalse();
            assertThat(single.path("error").asText()).startsWith("AUTH_ERROR");
            assertThat(send("POST", "/v1/models/ghost/test", null).statusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("Operations endpoints")
    class OperationsTests {

        @Test
        @DisplayName("health should be up while a model is enabled")
        void healthShouldTrackEnabledModels() throws Exception {
            HttpResponse<String> up = send("GET", "/health", null);
            assertThat(up.statusCode()).isEqualTo(200);
            assertThat(json(up).path("status").asText()).isEqualTo("UP");
            assertThat(json(up).path("enabledModels").asInt()).isEqualTo(2);

            send("POST", "/v1/models/alpha/disable", null);
            send("POST", "/v1/models/beta/disable", null);

            HttpResponse<String> down = send("GET", "/health", null);
            assertThat(down.statusCode()).isEqualTo(503);
            assertThat(json(down).path("status").asText()).isEqualTo("DOWN");
        }

        @Test
        @DisplayName("metrics should expose Prometheus text")
        void metricsShouldExposePrometheus() throws Exception {
            send("POST", "/v1/completions", "{\"prompt\":\"x\"}");

            HttpResponse<String> response = send("GET", "/metrics", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                    type -> assertThat(type).startsWith("text/plain"));
            assertThat(response.body()).contains("test_gateway_requests_total");
            assertThat(response.body()).contains("test_gateway_attempts_total");
        }
    }
}
