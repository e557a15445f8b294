package fr.lapetina.llmgateway.infrastructure.credentials;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credential store backed by a map, for tests and embedding.
 */
public final class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, String> keys = new ConcurrentHashMap<>();

    public InMemoryCredentialStore() {
    }

    public InMemoryCredentialStore(Map<String, String> keys) {
        keys.forEach(this::put);
    }

    public InMemoryCredentialStore put(String providerId, String apiKey) {
        keys.put(normalize(providerId), apiKey);
        return this;
    }

    public InMemoryCredentialStore remove(String providerId) {
        keys.remove(normalize(providerId));
        return this;
    }

    @Override
    public Optional<String> get(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        String value = keys.get(normalize(providerId));
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private static String normalize(String providerId) {
        return providerId.trim().toLowerCase(Locale.ROOT);
    }
}
