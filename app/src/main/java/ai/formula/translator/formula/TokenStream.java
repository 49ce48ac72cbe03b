package ai.formula.translator.formula;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered, immutable sequence of tokens in left-to-right source order.
 */
public final class TokenStream implements Iterable<Token> {

    private static final TokenStream EMPTY = new TokenStream(List.of());

    private final List<Token> tokens;

    private TokenStream(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static TokenStream of(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        return tokens.isEmpty() ? EMPTY : new TokenStream(List.copyOf(tokens));
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public Stream<Token> stream() {
        return tokens.stream();
    }

    public List<Token> slice(int fromInclusive, int toExclusive) {
        return tokens.subList(fromInclusive, toExclusive);
    }

    /**
     * Concatenated text of every token, i.e. the formula this stream serializes to.
     */
    public String text() {
        StringBuilder builder = new StringBuilder();
        for (Token token : tokens) {
            builder.append(token.text());
        }
        return builder.toString();
    }

    /**
     * Returns a new stream where {@code [fromInclusive, toExclusive)} is replaced by {@code replacement}.
     */
    public TokenStream splice(int fromInclusive, int toExclusive, List<Token> replacement) {
        if (fromInclusive < 0 || toExclusive > tokens.size() || fromInclusive > toExclusive) {
            throw new IndexOutOfBoundsException("Invalid splice range " + fromInclusive + ".." + toExclusive);
        }
        List<Token> copy = new ArrayList<>(tokens.size() - (toExclusive - fromInclusive) + replacement.size());
        copy.addAll(tokens.subList(0, fromInclusive));
        copy.addAll(replacement);
        copy.addAll(tokens.subList(toExclusive, tokens.size()));
        return of(copy);
    }

    /**
     * Upper-cased function names in order of first appearance.
     */
    public Set<String> functionNames() {
        return tokens.stream()
                .filter(token -> token.is(TokenKind.FUNCTION_NAME))
                .map(token -> token.text().toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean contains(TokenKind kind) {
        return tokens.stream().anyMatch(token -> token.is(kind));
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof TokenStream that && tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "TokenStream" + tokens;
    }
}
