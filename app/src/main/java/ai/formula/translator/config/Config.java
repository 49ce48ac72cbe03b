package ai.formula.translator.config;

import ai.formula.translator.structured.AddressingMode;
import ai.formula.translator.translate.TranslationSettings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path jobsFile,
        Optional<Path> outputFile,
        Optional<Path> rulesFile,
        Optional<Path> cacheFile,
        String sourceLocale,
        String targetLocale,
        int maxConcurrency,
        int maxRewriteIterations,
        AddressingMode addressingMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(jobsFile, "jobsFile");
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        rulesFile = rulesFile == null ? Optional.empty() : rulesFile;
        cacheFile = cacheFile == null ? Optional.empty() : cacheFile;
        sourceLocale = requireNonBlank(sourceLocale, "sourceLocale");
        targetLocale = requireNonBlank(targetLocale, "targetLocale");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        if (maxRewriteIterations < 1) {
            throw new IllegalArgumentException("maxRewriteIterations must be at least 1");
        }
        addressingMode = Objects.requireNonNull(addressingMode, "addressingMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
    }

    public TranslationSettings translationSettings() {
        return new TranslationSettings(maxConcurrency, translatorConfig.timeout(), maxRewriteIterations, addressingMode);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
