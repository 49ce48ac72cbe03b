package ai.formula.translator.translate;

import ai.formula.translator.formula.TranslationException;
import java.util.Objects;

/**
 * Failure of a language-model call. Always recovered per job.
 */
public class LlmCallException extends TranslationException {

    public enum Reason {
        TIMEOUT,
        CANCELLED,
        MODEL_UNAVAILABLE,
        RATE_LIMITED,
        FAILED
    }

    private final Reason reason;

    public LlmCallException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public LlmCallException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
