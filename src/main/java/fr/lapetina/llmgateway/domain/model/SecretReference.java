package fr.lapetina.llmgateway.domain.model;

import java.util.Objects;

/**
 * Opaque holder for a provider API key.
 *
 * The value is captured once when the registry is loaded and only revealed
 * to the adapter building the outgoing request. {@link #toString()} never
 * prints the secret.
 */
public final class SecretReference {

    private static final SecretReference EMPTY = new SecretReference(null);

    private final String value;

    private SecretReference(String value) {
        this.value = value;
    }

    public static SecretReference of(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }
        return new SecretReference(value);
    }

    public static SecretReference empty() {
        return EMPTY;
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * Returns the raw secret. Callers must not log the returned value.
     */
    public String reveal() {
        if (value == null) {
            throw new IllegalStateException("No secret available");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SecretReference that = (SecretReference) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "SecretReference[none]" : "SecretReference[****]";
    }
}
