package ai.formula.translator.rewrite;

import ai.formula.translator.formula.TokenStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Pattern over a function call: its name, optionally the call it is nested in, its arity and per-argument predicates.
 *
 * @param arguments predicates keyed by one-based argument position
 */
public record CallMatcher(String function,
                          Optional<String> enclosedBy,
                          OptionalInt arity,
                          OptionalInt minArity,
                          Map<Integer, ArgumentPredicate> arguments) {

    public CallMatcher {
        Objects.requireNonNull(function, "function");
        if (function.isBlank()) {
            throw new IllegalArgumentException("Matcher function must not be blank");
        }
        function = function.trim().toUpperCase(Locale.ROOT);
        enclosedBy = enclosedBy == null
                ? Optional.empty()
                : enclosedBy.filter(name -> !name.isBlank()).map(name -> name.trim().toUpperCase(Locale.ROOT));
        arity = arity == null ? OptionalInt.empty() : arity;
        minArity = minArity == null ? OptionalInt.empty() : minArity;
        if (arity.isPresent() && arity.getAsInt() < 0 || minArity.isPresent() && minArity.getAsInt() < 0) {
            throw new IllegalArgumentException("Arity must not be negative for " + function);
        }
        Map<Integer, ArgumentPredicate> sorted = new TreeMap<>();
        if (arguments != null) {
            for (Map.Entry<Integer, ArgumentPredicate> entry : arguments.entrySet()) {
                if (entry.getKey() == null || entry.getKey() < 1) {
                    throw new IllegalArgumentException("Argument positions are one-based in matcher for " + function);
                }
                if (arity.isPresent() && entry.getKey() > arity.getAsInt()) {
                    throw new IllegalArgumentException("Argument " + entry.getKey() + " exceeds arity of " + function);
                }
                sorted.put(entry.getKey(), Objects.requireNonNull(entry.getValue(), "predicate"));
            }
        }
        arguments = Map.copyOf(sorted);
    }

    public static CallMatcher of(String function) {
        return new CallMatcher(function, Optional.empty(), OptionalInt.empty(), OptionalInt.empty(), Map.of());
    }

    public boolean matches(CallNode node, TokenStream tokens) {
        if (!node.functionName(tokens).equals(function)) {
            return false;
        }
        if (enclosedBy.isPresent()) {
            if (!node.hasEnclosingCall()) {
                return false;
            }
            String enclosing = tokens.get(node.enclosingNameIndex()).text().toUpperCase(Locale.ROOT);
            if (!enclosing.equals(enclosedBy.get())) {
                return false;
            }
        }
        int actualArity = node.arity(tokens);
        if (arity.isPresent() && actualArity != arity.getAsInt()) {
            return false;
        }
        if (minArity.isPresent() && actualArity < minArity.getAsInt()) {
            return false;
        }
        for (Map.Entry<Integer, ArgumentPredicate> entry : arguments.entrySet()) {
            int position = entry.getKey();
            if (position > actualArity || !entry.getValue().test(node.argument(tokens, position))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copy with function names translated, e.g. to the names a target locale uses.
     */
    public CallMatcher localize(UnaryOperator<String> functionNames) {
        return new CallMatcher(functionNames.apply(function), enclosedBy.map(functionNames), arity, minArity, arguments);
    }
}
