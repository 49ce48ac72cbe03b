package ai.formula.translator.translate;

import java.time.Duration;

/**
 * Language-model collaborator asked to translate formulas the deterministic pipeline could not fully handle.
 */
@FunctionalInterface
public interface FormulaLlmClient {

    /**
     * Returns candidate target formula text. Implementations should give up once {@code timeout} has elapsed.
     *
     * @throws LlmCallException when the call fails, times out or is cancelled
     */
    String translate(LlmTranslationRequest request, Duration timeout);
}
