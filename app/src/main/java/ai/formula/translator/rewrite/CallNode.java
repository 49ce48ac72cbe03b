package ai.formula.translator.rewrite;

import ai.formula.translator.formula.Token;
import ai.formula.translator.formula.TokenStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Position of one function call inside a token stream.
 *
 * @param nameIndex          index of the {@code FUNCTION_NAME} token
 * @param openIndex          index of the opening parenthesis
 * @param closeIndex         index of the matching closing parenthesis
 * @param arguments          top-level argument spans, separators excluded
 * @param enclosingNameIndex name index of the innermost enclosing call, or {@code -1}
 */
public record CallNode(int nameIndex, int openIndex, int closeIndex, List<Span> arguments, int enclosingNameIndex) {

    /**
     * Half-open token index range {@code [start, end)}.
     */
    public record Span(int start, int end) {

        public Span {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid span " + start + ".." + end);
            }
        }
    }

    public CallNode {
        Objects.requireNonNull(arguments, "arguments");
        arguments = List.copyOf(arguments);
    }

    public String functionName(TokenStream tokens) {
        return tokens.get(nameIndex).text().toUpperCase(Locale.ROOT);
    }

    /**
     * Number of arguments; a call with nothing but whitespace between its parentheses has none.
     */
    public int arity(TokenStream tokens) {
        if (arguments.size() == 1 && significant(tokens, arguments.get(0)).isEmpty()) {
            return 0;
        }
        return arguments.size();
    }

    /**
     * Tokens of a one-based argument with surrounding whitespace removed.
     */
    public List<Token> argument(TokenStream tokens, int position) {
        return significant(tokens, arguments.get(position - 1));
    }

    public boolean hasEnclosingCall() {
        return enclosingNameIndex >= 0;
    }

    static List<Token> significant(TokenStream tokens, Span span) {
        int start = span.start();
        int end = span.end();
        while (start < end && tokens.get(start).isWhitespace()) {
            start++;
        }
        while (end > start && tokens.get(end - 1).isWhitespace()) {
            end--;
        }
        return tokens.slice(start, end);
    }
}
