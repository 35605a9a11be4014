package dev.llumos.domain.valueobject;

/**
 * Normalized answer from any provider. Token counts are zero when the provider does not report them.
 */
public record ProviderAnswer(String text, String model, int tokensIn, int tokensOut) {
    public ProviderAnswer {
        if (text == null) text = "";
        if (tokensIn < 0) tokensIn = 0;
        if (tokensOut < 0) tokensOut = 0;
    }
}
