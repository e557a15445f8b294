/**
 * Immutable domain types shared by routing, dispatch and the HTTP API.
 *
 * <p>{@link fr.lapetina.llmgateway.domain.model.ModelConfig} describes a routable model,
 * {@link fr.lapetina.llmgateway.domain.model.CompletionRequest} and
 * {@link fr.lapetina.llmgateway.domain.model.CompletionResult} carry a gateway call,
 * and {@link fr.lapetina.llmgateway.domain.model.ProviderResponse} is the normalized
 * outcome every provider adapter reports.
 */
package fr.lapetina.llmgateway.domain.model;
