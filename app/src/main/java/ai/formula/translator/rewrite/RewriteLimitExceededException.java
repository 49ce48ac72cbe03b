package ai.formula.translator.rewrite;

import ai.formula.translator.formula.TranslationException;

/**
 * Raised when rule application does not reach a fixed point within the configured iteration limit.
 */
public class RewriteLimitExceededException extends TranslationException {

    private final int limit;

    public RewriteLimitExceededException(int limit, String lastRule) {
        super("Rewrite did not converge after " + limit + " rule applications (last rule: " + lastRule + ")");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
