package ai.formula.translator.rewrite;

import ai.formula.translator.formula.TokenStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies incompatibility rules until none matches.
 *
 * <p>Each pass re-parses the current stream, picks the leftmost outermost call matched by any rule
 * (rules are tried in declaration order) and splices in the rule's template. A rewritten call that
 * becomes an argument of another matching call is therefore handled by a later pass.</p>
 */
public class IncompatibilityRewriter {

    public static final int DEFAULT_MAX_ITERATIONS = 32;

    private static final Logger LOGGER = LoggerFactory.getLogger(IncompatibilityRewriter.class);

    private final List<IncompatibilityRule> rules;
    private final int maxIterations;

    public IncompatibilityRewriter(List<IncompatibilityRule> rules) {
        this(rules, DEFAULT_MAX_ITERATIONS);
    }

    public IncompatibilityRewriter(List<IncompatibilityRule> rules, int maxIterations) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        this.maxIterations = maxIterations;
    }

    public List<IncompatibilityRule> rules() {
        return rules;
    }

    /**
     * @throws RewriteLimitExceededException when more than {@code maxIterations} rule applications would be needed
     */
    public RewriteResult rewrite(TokenStream tokens, RewriteContext context) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(context, "context");
        if (rules.isEmpty()) {
            return new RewriteResult(tokens, List.of(), 0);
        }
        TokenStream current = tokens;
        List<String> notes = new ArrayList<>();
        int applications = 0;
        while (true) {
            Application next = nextApplication(current);
            if (next == null) {
                return new RewriteResult(current, notes, applications);
            }
            if (applications >= maxIterations) {
                throw new RewriteLimitExceededException(maxIterations, next.rule().name());
            }
            CallNode node = next.node();
            String function = node.functionName(current);
            current = current.splice(node.nameIndex(), node.closeIndex() + 1,
                    next.rule().template().instantiate(node, current, context));
            applications++;
            LOGGER.debug("Applied rule {} to {} call", next.rule().name(), function);
            notes.add("Applied rule " + next.rule().name() + " to " + function + " call");
        }
    }

    private Application nextApplication(TokenStream tokens) {
        for (CallNode node : CallNodeParser.parse(tokens)) {
            for (IncompatibilityRule rule : rules) {
                if (rule.matcher().matches(node, tokens)) {
                    return new Application(node, rule);
                }
            }
        }
        return null;
    }

    private record Application(CallNode node, IncompatibilityRule rule) {
    }
}
