package ai.formula.translator.rules;

import ai.formula.translator.locale.FormulaLocale;
import ai.formula.translator.mapping.FunctionMapTable;
import ai.formula.translator.rewrite.IncompatibilityRule;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable rule data shared by every translation: known locales, the function map and the incompatibility rules.
 */
public record RuleSet(Map<String, FormulaLocale> locales,
                      FunctionMapTable functions,
                      List<IncompatibilityRule> incompatibilities) {

    public RuleSet {
        locales = Map.copyOf(Objects.requireNonNull(locales, "locales"));
        Objects.requireNonNull(functions, "functions");
        incompatibilities = incompatibilities == null ? List.of() : List.copyOf(incompatibilities);
    }

    public Optional<FormulaLocale> locale(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        FormulaLocale exact = locales.get(tag.trim());
        if (exact != null) {
            return Optional.of(exact);
        }
        return locales.values().stream()
                .filter(locale -> locale.tag().equalsIgnoreCase(tag.trim()))
                .findFirst();
    }

    public FormulaLocale requireLocale(String tag) {
        return locale(tag).orElseThrow(() -> new IllegalArgumentException("Unknown locale: " + tag));
    }

    /**
     * Incompatibility rules with their function names translated into the names used by {@code target}.
     */
    public List<IncompatibilityRule> rulesFor(FormulaLocale target) {
        return incompatibilities.stream()
                .map(rule -> rule.localize(name -> functions.lookup(name, target.tag()).orElse(name)))
                .toList();
    }
}
