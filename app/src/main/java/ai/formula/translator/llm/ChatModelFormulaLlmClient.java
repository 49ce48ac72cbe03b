package ai.formula.translator.llm;

import ai.formula.translator.locale.FormulaLocale;
import ai.formula.translator.translate.FormulaLlmClient;
import ai.formula.translator.translate.LlmCallException;
import ai.formula.translator.translate.LlmTranslationRequest;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FormulaLlmClient} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Rate-limited calls are retried with exponential backoff and jitter, as long as the next attempt
 * still fits in the caller's timeout.</p>
 */
public class ChatModelFormulaLlmClient implements FormulaLlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelFormulaLlmClient.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile(
            "(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final ChatModel model;
    private final String providerName;
    private final String modelName;
    private final RetryPolicy retryPolicy;

    public ChatModelFormulaLlmClient(ChatModel model, String providerName, String modelName) {
        this(model, providerName, modelName, RetryPolicy.defaults());
    }

    public ChatModelFormulaLlmClient(ChatModel model, String providerName, String modelName, RetryPolicy retryPolicy) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    @Override
    public String translate(LlmTranslationRequest request, Duration timeout) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(timeout, "timeout");
        long deadline = System.nanoTime() + timeout.toNanos();
        String prompt = buildPrompt(request);
        for (int attempt = 0; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new LlmCallException(LlmCallException.Reason.CANCELLED, "LLM call cancelled before attempt " + (attempt + 1));
            }
            try {
                String response = model.chat(prompt);
                return response == null ? "" : response;
            } catch (RuntimeException ex) {
                if (isModelMissing(ex)) {
                    throw new LlmCallException(LlmCallException.Reason.MODEL_UNAVAILABLE,
                            "%s model '%s' is not available.".formatted(providerName, modelName), ex);
                }
                if (!isRateLimitError(ex)) {
                    throw new LlmCallException(LlmCallException.Reason.FAILED,
                            providerName + " formula translation failed: " + ex.getMessage(), ex);
                }
                if (attempt + 1 >= retryPolicy.maxAttempts()) {
                    LOGGER.error("Formula translation rate limited; max retries ({}) exceeded", retryPolicy.maxAttempts());
                    throw new LlmCallException(LlmCallException.Reason.RATE_LIMITED,
                            "Rate limited after " + retryPolicy.maxAttempts() + " attempts", ex);
                }
                Duration delay = retryDelay(ex, attempt);
                if (delay.toNanos() >= deadline - System.nanoTime()) {
                    throw new LlmCallException(LlmCallException.Reason.TIMEOUT,
                            "Rate limited and the next retry would exceed the " + timeout.toMillis() + " ms budget", ex);
                }
                LOGGER.warn("Formula translation rate limited (429/RESOURCE_EXHAUSTED); retrying in {} ms (attempt {}/{})",
                        delay.toMillis(), attempt + 1, retryPolicy.maxAttempts());
                sleep(delay);
            }
        }
    }

    String buildPrompt(LlmTranslationRequest request) {
        FormulaLocale source = request.localePair().source();
        FormulaLocale target = request.localePair().target();
        StringBuilder hints = new StringBuilder();
        for (String hint : request.hints()) {
            hints.append("- ").append(hint).append('\n');
        }
        return """
Translate this spreadsheet formula from Excel (%s) to LibreOffice Calc for the %s locale.

Formula:
%s

Requirements:
1. Use the %s function names (for de-DE e.g. SUM->SUMME, IF->WENN, MATCH->VERGLEICH, VLOOKUP->SVERWEIS, COUNT->ANZAHL).
2. Separate function arguments with '%s' and write decimal numbers with '%s'.
3. Keep cell references, ranges, operators, string literals, numbers and logical values unchanged.
4. Keep nested functions intact; the formula must compute the same result as the original.

Known facts about this formula:
%s
Output ONLY the translated formula on a single line, without a leading '=', code fences or explanations.

Example (en-US to de-DE):
Input: IF(A1>0,SUM(B1:B10),0.5)
Output: WENN(A1>0;SUMME(B1:B10);0,5)
""".formatted(source.tag(), target.tag(), request.sourceFormulaText(), target.tag(),
                target.argumentSeparator(), target.decimalSeparator(),
                hints.length() == 0 ? "- none\n" : hints.toString());
    }

    private Duration retryDelay(Throwable throwable, int attemptNumber) {
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay.get();
        }
        long baseMillis = retryPolicy.initialBackoff().toMillis() * (1L << Math.min(attemptNumber, 20));
        long cappedMillis = Math.min(baseMillis, retryPolicy.maxBackoff().toMillis());
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * retryPolicy.jitterFactor();
        return Duration.ofMillis(Math.max(1, (long) (cappedMillis * jitter)));
    }

    private void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LlmCallException(LlmCallException.Reason.CANCELLED, "LLM retry interrupted", ex);
        }
    }

    private static boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double seconds = Double.parseDouble(matcher.group(1));
        return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
