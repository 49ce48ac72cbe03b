package ai.formula.translator.config;

import ai.formula.translator.cli.CliArguments;
import ai.formula.translator.rewrite.IncompatibilityRewriter;
import ai.formula.translator.structured.AddressingMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_JOBS_PATH = "FORMULA_JOBS_PATH";
    static final String ENV_OUTPUT_PATH = "FORMULA_OUTPUT_PATH";
    static final String ENV_RULES_PATH = "FORMULA_RULES_PATH";
    static final String ENV_CACHE_PATH = "FORMULA_CACHE_PATH";
    static final String ENV_SOURCE_LOCALE = "SOURCE_LOCALE";
    static final String ENV_TARGET_LOCALE = "TARGET_LOCALE";
    static final String ENV_MAX_CONCURRENCY = "MAX_CONCURRENCY";
    static final String ENV_MAX_REWRITE_ITERATIONS = "MAX_REWRITE_ITERATIONS";
    static final String ENV_STRUCTURED_REFERENCE_MODE = "STRUCTURED_REFERENCE_MODE";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";

    private static final String DEFAULT_SOURCE_LOCALE = "en-US";
    private static final String DEFAULT_TARGET_LOCALE = "de-DE";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_LLM_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 6;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path jobsFile = Optional.ofNullable(arguments.jobsFile())
                .or(() -> env(ENV_JOBS_PATH).map(Path::of))
                .orElseThrow(() -> new IllegalArgumentException("jobs file must be provided via --jobs or " + ENV_JOBS_PATH));
        Optional<Path> outputFile = resolvePath(arguments.outputFile(), ENV_OUTPUT_PATH);
        Optional<Path> rulesFile = resolvePath(arguments.rulesFile(), ENV_RULES_PATH);
        Optional<Path> cacheFile = resolvePath(arguments.cacheFile(), ENV_CACHE_PATH);

        String sourceLocale = firstNonBlank(arguments.sourceLocale(), ENV_SOURCE_LOCALE, DEFAULT_SOURCE_LOCALE);
        String targetLocale = firstNonBlank(arguments.targetLocale(), ENV_TARGET_LOCALE, DEFAULT_TARGET_LOCALE);

        int maxConcurrency = Optional.ofNullable(arguments.maxConcurrency())
                .or(() -> env(ENV_MAX_CONCURRENCY).map(value -> parsePositiveInteger(ENV_MAX_CONCURRENCY, value)))
                .orElse(Runtime.getRuntime().availableProcessors());
        int maxRewriteIterations = Optional.ofNullable(arguments.maxRewriteIterations())
                .or(() -> env(ENV_MAX_REWRITE_ITERATIONS).map(value -> parsePositiveInteger(ENV_MAX_REWRITE_ITERATIONS, value)))
                .orElse(IncompatibilityRewriter.DEFAULT_MAX_ITERATIONS);
        AddressingMode addressingMode = Optional.ofNullable(arguments.addressingMode())
                .or(() -> env(ENV_STRUCTURED_REFERENCE_MODE).map(AddressingMode::from))
                .orElse(AddressingMode.ABSOLUTE_COLUMN);
        LogFormat logFormat = resolveLogFormat(arguments);

        Optional<String> geminiApiKey = env(ENV_GEMINI_API_KEY);
        LlmProvider provider = resolveProvider(arguments);
        TranslatorConfig translatorConfig = provider == LlmProvider.NONE
                ? disabledTranslator()
                : resolveTranslatorConfig(provider);

        return new Config(jobsFile, outputFile, rulesFile, cacheFile, sourceLocale, targetLocale, maxConcurrency,
                maxRewriteIterations, addressingMode, logFormat, translatorConfig, new Secrets(geminiApiKey));
    }

    private LlmProvider resolveProvider(CliArguments arguments) {
        if (arguments.noLlm()) {
            return LlmProvider.NONE;
        }
        LlmProvider cliProvider = arguments.llmProvider();
        if (cliProvider != null) {
            return cliProvider;
        }
        return env(ENV_LLM_PROVIDER).map(LlmProvider::from).orElse(LlmProvider.NONE);
    }

    private TranslatorConfig resolveTranslatorConfig(LlmProvider provider) {
        String modelName = env(ENV_LLM_MODEL).orElse(defaultModelFor(provider));
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        return new TranslatorConfig(provider, modelName, baseUrl, resolveTimeout(),
                positiveIntegerOrDefault(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS),
                positiveIntegerOrDefault(ENV_LLM_INITIAL_BACKOFF_SECONDS, DEFAULT_LLM_INITIAL_BACKOFF_SECONDS),
                positiveIntegerOrDefault(ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS),
                env(ENV_LLM_RETRY_JITTER_FACTOR).map(ConfigLoader::parseDouble).orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR));
    }

    private TranslatorConfig disabledTranslator() {
        return new TranslatorConfig(LlmProvider.NONE, "none", Optional.empty(), resolveTimeout(), 1, 1, 1, 0.0);
    }

    private Duration resolveTimeout() {
        return Duration.ofSeconds(positiveIntegerOrDefault(ENV_LLM_TIMEOUT_SECONDS, DEFAULT_LLM_TIMEOUT_SECONDS));
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "gemini-1.5-flash";
            case OLLAMA -> "qwen2.5-coder:7b";
            case NONE -> "none";
        };
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return env(envKey).map(Path::of);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return env(envKey).orElse(defaultValue);
    }

    private int positiveIntegerOrDefault(String envKey, int defaultValue) {
        return env(envKey).map(value -> parsePositiveInteger(envKey, value)).orElse(defaultValue);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private static int parsePositiveInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
