package fr.lapetina.llmgateway.infrastructure.credentials;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads API keys from {@code <PROVIDER>_API_KEY} environment variables,
 * e.g. {@code DEEPSEEK_API_KEY}. Blank values count as absent.
 */
public final class EnvironmentCredentialStore implements CredentialStore {

    static final String SUFFIX = "_API_KEY";

    private final Function<String, String> environment;

    public EnvironmentCredentialStore() {
        this(System::getenv);
    }

    /**
     * @param environment variable lookup, returning null for unset variables
     */
    public EnvironmentCredentialStore(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "Environment lookup is required");
    }

    @Override
    public Optional<String> get(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return Optional.empty();
        }
        String value = environment.apply(variableName(providerId));
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public static String variableName(String providerId) {
        return providerId.trim().toUpperCase(Locale.ROOT) + SUFFIX;
    }
}
