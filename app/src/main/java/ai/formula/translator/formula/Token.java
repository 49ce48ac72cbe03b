package ai.formula.translator.formula;

import java.util.Objects;

/**
 * Immutable lexical unit carrying the exact source substring it was produced from.
 */
public record Token(TokenKind kind, String text) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static Token of(TokenKind kind, String text) {
        return new Token(kind, text);
    }

    public Token withText(String replacement) {
        return new Token(kind, replacement);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isWhitespace() {
        return kind == TokenKind.WHITESPACE;
    }
}
