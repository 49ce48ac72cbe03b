package ai.formula.translator.rewrite;

import ai.formula.translator.formula.TokenStream;
import java.util.List;
import java.util.Objects;

public record RewriteResult(TokenStream tokens, List<String> notes, int applications) {

    public RewriteResult {
        Objects.requireNonNull(tokens, "tokens");
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
