package ai.formula.translator.locale;

import ai.formula.translator.formula.TokenStream;
import java.util.List;
import java.util.Objects;

public record NormalizationResult(TokenStream tokens, List<String> notes) {

    public NormalizationResult {
        Objects.requireNonNull(tokens, "tokens");
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
