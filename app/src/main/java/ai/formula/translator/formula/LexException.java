package ai.formula.translator.formula;

import java.util.Objects;

/**
 * Raised when formula text cannot be split into tokens.
 */
public class LexException extends TranslationException {

    public enum Kind {
        UNTERMINATED_LITERAL,
        UNBALANCED_DELIMITER
    }

    private final Kind kind;
    private final int offset;

    public LexException(Kind kind, int offset, String detail) {
        super("%s at offset %d: %s".formatted(Objects.requireNonNull(kind, "kind"), offset, detail));
        this.kind = kind;
        this.offset = offset;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * UTF-8 byte offset of the offending quote or delimiter within the formula text.
     */
    public int offset() {
        return offset;
    }
}
