package fr.lapetina.llmgateway.infrastructure.provider;

import fr.lapetina.llmgateway.domain.model.ModelConfig;

/**
 * Resolves the adapter serving a model.
 */
@FunctionalInterface
public interface AdapterResolver {

    /**
     * @throws IllegalArgumentException if no adapter variant handles the model's provider
     */
    ProviderAdapter resolve(ModelConfig model);
}
