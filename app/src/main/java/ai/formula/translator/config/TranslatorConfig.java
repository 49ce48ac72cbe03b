package ai.formula.translator.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the language-model fallback: provider, model, endpoint, call timeout and rate-limit retries.
 */
public record TranslatorConfig(LlmProvider provider,
                               String modelName,
                               Optional<String> baseUrl,
                               Duration timeout,
                               int maxRetryAttempts,
                               int initialBackoffSeconds,
                               int maxBackoffSeconds,
                               double retryJitterFactor) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = provider == LlmProvider.NONE && (modelName == null || modelName.isBlank())
                ? "none"
                : requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1 || maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("backoff must satisfy 1 <= initial <= max");
        }
        if (retryJitterFactor < 0.0 || retryJitterFactor > 1.0) {
            throw new IllegalArgumentException("retryJitterFactor must be between 0.0 and 1.0");
        }
    }

    public boolean isEnabled() {
        return provider != LlmProvider.NONE;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
