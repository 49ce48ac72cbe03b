package ai.formula.translator.rules;

/**
 * Raised when the rule set cannot be read or is invalid. Fatal at startup.
 */
public class RuleLoadException extends RuntimeException {

    public RuleLoadException(String message) {
        super(message);
    }

    public RuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
