/**
 * Provider adapters.
 *
 * <p>One {@link fr.lapetina.llmgateway.infrastructure.provider.ProviderAdapter}
 * per configured model, created by
 * {@link fr.lapetina.llmgateway.infrastructure.provider.ProviderAdapterFactory}
 * from the variant registered for its provider family:
 * <ul>
 *   <li>{@code OpenAiCompatibleAdapter} - OpenAI, DeepSeek, Zhipu, Qwen, Moonshot</li>
 *   <li>{@code AnthropicAdapter} - Anthropic Messages API</li>
 * </ul>
 *
 * <p>Failures are values, not exceptions:
 * <table>
 *   <caption>Failure classification</caption>
 *   <tr><th>Cause</th><th>Error type</th></tr>
 *   <tr><td>HTTP 401 / 403, missing API key</td><td>AUTH_ERROR</td></tr>
 *   <tr><td>HTTP 429</td><td>RATE_LIMITED</td></tr>
 *   <tr><td>HTTP 408, request timeout</td><td>TIMEOUT</td></tr>
 *   <tr><td>other non-2xx status, I/O failure</td><td>SERVER_ERROR</td></tr>
 *   <tr><td>unparseable body, missing content</td><td>MALFORMED_RESPONSE</td></tr>
 * </table>
 */
package fr.lapetina.llmgateway.infrastructure.provider;
