package fr.lapetina.llmgateway.infrastructure.credentials;

import java.util.Optional;

/**
 * Source of provider API keys.
 *
 * Keys are looked up once per model when the registry is loaded and then
 * carried as a {@link fr.lapetina.llmgateway.domain.model.SecretReference}.
 */
@FunctionalInterface
public interface CredentialStore {

    /**
     * Returns the API key of a provider family.
     *
     * @param providerId lowercase provider identifier, e.g. {@code deepseek}
     */
    Optional<String> get(String providerId);
}
