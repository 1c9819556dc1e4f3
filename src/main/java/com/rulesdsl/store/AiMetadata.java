package com.rulesdsl.store;

/**
 * Provenance of an AI-authored rule.
 *
 * @param generated       Whether the rule came from the rule builder
 * @param confidence      Builder confidence (0-100)
 * @param originalText    Plain English text the rule was generated from
 * @param refinementCount Number of logic updates since the rule was saved
 */
public record AiMetadata(boolean generated, int confidence, String originalText, int refinementCount) {

    static final int DEFAULT_CONFIDENCE = 85;

    public static AiMetadata generatedFrom(String originalText) {
        return new AiMetadata(true, DEFAULT_CONFIDENCE, originalText, 0);
    }

    public AiMetadata refined() {
        return new AiMetadata(generated, confidence, originalText, refinementCount + 1);
    }
}
