package ai.formula.translator.structured;

import ai.formula.translator.formula.TranslationException;
import java.util.Objects;

/**
 * Raised when a structured reference cannot be turned into plain cell coordinates.
 */
public class ResolveException extends TranslationException {

    public enum Kind {
        UNKNOWN_TABLE,
        UNKNOWN_COLUMN,
        NO_ENCLOSING_TABLE,
        MALFORMED_REFERENCE
    }

    private final Kind kind;
    private final String reference;

    public ResolveException(Kind kind, String reference, String detail) {
        super("%s in %s: %s".formatted(Objects.requireNonNull(kind, "kind"), reference, detail));
        this.kind = kind;
        this.reference = reference;
    }

    public Kind kind() {
        return kind;
    }

    public String reference() {
        return reference;
    }
}
