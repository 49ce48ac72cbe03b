package ai.formula.translator.config;

import java.util.Locale;

/**
 * Language-model backends available for the translation fallback.
 */
public enum LlmProvider {
    NONE,
    OLLAMA,
    GEMINI;

    public static LlmProvider from(String value) {
        if (value == null) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none", "off", "" -> NONE;
            case "ollama" -> OLLAMA;
            case "gemini" -> GEMINI;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
