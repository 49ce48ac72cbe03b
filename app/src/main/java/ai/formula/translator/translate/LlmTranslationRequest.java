package ai.formula.translator.translate;

import ai.formula.translator.locale.LocalePair;
import java.util.List;
import java.util.Objects;

/**
 * @param hints facts gathered by the deterministic pipeline: unmapped functions, resolve errors, known incompatibilities
 */
public record LlmTranslationRequest(String sourceFormulaText, LocalePair localePair, List<String> hints) {

    public LlmTranslationRequest {
        Objects.requireNonNull(sourceFormulaText, "sourceFormulaText");
        Objects.requireNonNull(localePair, "localePair");
        hints = hints == null ? List.of() : List.copyOf(hints);
    }
}
