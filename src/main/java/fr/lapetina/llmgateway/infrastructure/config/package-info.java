/**
 * Configuration loading.
 *
 * <p>YAML is parsed by SnakeYAML into the
 * {@link fr.lapetina.llmgateway.infrastructure.config.GatewayConfig} bean tree,
 * then mapped to domain objects by
 * {@link fr.lapetina.llmgateway.infrastructure.config.ModelConfigMapper}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog)</li>
 *   <li>{@code models} - routable models</li>
 *   <li>{@code prices} - USD per 1M tokens, per model id or per provider</li>
 *   <li>{@code routing} - default strategy for requests that name none</li>
 *   <li>{@code timeouts} - request, connect and check timeouts</li>
 *   <li>{@code stats} - latency window size</li>
 *   <li>{@code healthCheck} - periodic checks</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.llmgateway.infrastructure.config;
