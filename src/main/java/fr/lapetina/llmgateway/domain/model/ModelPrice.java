package fr.lapetina.llmgateway.domain.model;

/**
 * Token pricing in USD per one million tokens.
 */
public record ModelPrice(double inputPerMillion, double outputPerMillion) {

    private static final double ONE_MILLION = 1_000_000d;

    public ModelPrice {
        if (inputPerMillion < 0 || outputPerMillion < 0) {
            throw new IllegalArgumentException("Prices must not be negative");
        }
    }

    /**
     * Combined input and output price, used to compare models.
     */
    public double combinedPerMillion() {
        return inputPerMillion + outputPerMillion;
    }

    public double costOf(TokenUsage usage) {
        return usage.promptTokens() / ONE_MILLION * inputPerMillion
                + usage.completionTokens() / ONE_MILLION * outputPerMillion;
    }
}
