package ai.formula.translator.rewrite;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Declarative rewrite of a call pattern that behaves differently, or is unsupported, in the target dialect.
 */
public record IncompatibilityRule(String name, String description, CallMatcher matcher, RewriteTemplate template) {

    public IncompatibilityRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name must not be blank");
        }
        name = name.trim();
        description = description == null ? "" : description.trim();
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(template, "template");
        if (matcher.arity().isPresent() && template.highestArgument() > matcher.arity().getAsInt()) {
            throw new IllegalArgumentException("Template of rule " + name + " reads argument "
                    + template.highestArgument() + " but the matcher requires arity " + matcher.arity().getAsInt());
        }
    }

    public IncompatibilityRule localize(UnaryOperator<String> functionNames) {
        return new IncompatibilityRule(name, description, matcher.localize(functionNames), template);
    }
}
