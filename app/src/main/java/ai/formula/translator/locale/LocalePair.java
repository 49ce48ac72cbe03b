package ai.formula.translator.locale;

import java.util.Objects;

/**
 * Direction of a translation.
 */
public record LocalePair(FormulaLocale source, FormulaLocale target) {

    public LocalePair {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public static LocalePair of(FormulaLocale source, FormulaLocale target) {
        return new LocalePair(source, target);
    }

    @Override
    public String toString() {
        return source.tag() + "->" + target.tag();
    }
}
