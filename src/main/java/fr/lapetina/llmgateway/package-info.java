/**
 * LLM Gateway - routes chat completions across interchangeable AI model providers.
 *
 * <p>Each request is ranked against the enabled models by a routing policy,
 * dispatched in rank order with single-pass failover, and accounted in
 * per-model rolling statistics that feed later routing decisions.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmgateway.GatewayFactory} - Main entry point for creating
 *       a fully-configured gateway from YAML configuration</li>
 *   <li>{@link fr.lapetina.llmgateway.LlmGatewayApplication} - Standalone HTTP server
 *       exposing the JSON API</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("gateway.yaml").start()) {
 *     GatewayCore gateway = factory.getGateway();
 *
 *     CompletionRequest request = CompletionRequest.ofPrompt(RoutingStrategy.SMART, "Hello!");
 *     CompletionResult result = gateway.complete(request).join();
 *
 *     System.out.println(result.modelId() + ": " + result.content());
 *     System.out.println(result.routing().reason());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Routing policies: smart, cost, speed, priority</li>
 *   <li>OpenAI-compatible and Anthropic provider adapters</li>
 *   <li>Per-attempt timeouts and failover</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.llmgateway.GatewayFactory
 * @see fr.lapetina.llmgateway.core.GatewayCore
 */
package fr.lapetina.llmgateway;
