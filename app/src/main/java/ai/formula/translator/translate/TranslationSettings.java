package ai.formula.translator.translate;

import ai.formula.translator.structured.AddressingMode;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of the orchestrator.
 */
public record TranslationSettings(int maxConcurrency,
                                  Duration llmTimeout,
                                  int maxRewriteIterations,
                                  AddressingMode addressingMode) {

    public TranslationSettings {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        Objects.requireNonNull(llmTimeout, "llmTimeout");
        if (llmTimeout.isNegative() || llmTimeout.isZero()) {
            throw new IllegalArgumentException("llmTimeout must be positive");
        }
        if (maxRewriteIterations < 1) {
            throw new IllegalArgumentException("maxRewriteIterations must be at least 1");
        }
        Objects.requireNonNull(addressingMode, "addressingMode");
    }

    public TranslationSettings withLlmTimeout(Duration timeout) {
        return new TranslationSettings(maxConcurrency, timeout, maxRewriteIterations, addressingMode);
    }

    public TranslationSettings withMaxConcurrency(int concurrency) {
        return new TranslationSettings(concurrency, llmTimeout, maxRewriteIterations, addressingMode);
    }

    public TranslationSettings withAddressingMode(AddressingMode mode) {
        return new TranslationSettings(maxConcurrency, llmTimeout, maxRewriteIterations, mode);
    }
}
