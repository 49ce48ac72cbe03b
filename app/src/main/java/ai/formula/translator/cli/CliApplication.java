package ai.formula.translator.cli;

import ai.formula.translator.config.Config;
import ai.formula.translator.config.ConfigLoader;
import ai.formula.translator.config.Secrets;
import ai.formula.translator.config.SystemEnvironmentReader;
import ai.formula.translator.config.TranslatorConfig;
import ai.formula.translator.llm.ChatModelFormulaLlmClient;
import ai.formula.translator.llm.RetryPolicy;
import ai.formula.translator.logging.LoggingConfigurator;
import ai.formula.translator.rules.RuleLoadException;
import ai.formula.translator.rules.RuleSet;
import ai.formula.translator.rules.RuleSetLoader;
import ai.formula.translator.translate.BatchResult;
import ai.formula.translator.translate.FormulaJob;
import ai.formula.translator.translate.FormulaLlmClient;
import ai.formula.translator.translate.TranslationOrchestrator;
import ai.formula.translator.translate.cache.InMemoryTranslationCache;
import ai.formula.translator.translate.cache.TranslationCache;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation engine.
 */
public final class CliApplication {

    static final int EXIT_INVALID_SETUP = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Function<Config, Optional<FormulaLlmClient>> llmClientFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createLlmClient);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, Optional<FormulaLlmClient>> llmClientFactory) {
        this.configLoader = configLoader;
        this.llmClientFactory = llmClientFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_INVALID_SETUP;
        }
        LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
        LOGGER.info("Translating {} from {} to {} (llm={}, concurrency={})", config.jobsFile(),
                config.sourceLocale(), config.targetLocale(), config.translatorConfig().provider(), config.maxConcurrency());

        RuleSet ruleSet;
        List<FormulaJob> jobs;
        TranslationCache cache = new InMemoryTranslationCache();
        try {
            RuleSetLoader ruleSetLoader = new RuleSetLoader();
            ruleSet = config.rulesFile().map(ruleSetLoader::load).orElseGet(ruleSetLoader::loadDefault);
            jobs = new JobFileReader().read(config.jobsFile(), ruleSet, config.sourceLocale(), config.targetLocale());
            config.cacheFile().ifPresent(path -> importCache(cache, path));
        } catch (RuleLoadException | IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.error("Cannot start translation: {}", ex.getMessage(), ex);
            return EXIT_INVALID_SETUP;
        }

        Optional<FormulaLlmClient> llmClient = llmClientFactory.apply(config);
        BatchResult result;
        try (TranslationOrchestrator orchestrator = new TranslationOrchestrator(ruleSet, cache,
                llmClient.orElse(null), config.translationSettings())) {
            Thread abortHook = new Thread(orchestrator::abort, "formula-abort");
            Runtime.getRuntime().addShutdownHook(abortHook);
            try {
                result = orchestrator.translateAll(jobs);
            } finally {
                removeShutdownHook(abortHook);
            }
        }

        writeResults(config, result);
        config.cacheFile().ifPresent(path -> exportCache(cache, path));
        if (result.summary().unsupported() > 0) {
            LOGGER.warn("{} of {} formulas could not be translated", result.summary().unsupported(), result.summary().total());
        }
        return 0;
    }

    private static void writeResults(Config config, BatchResult result) {
        ResultWriter writer = new ResultWriter();
        if (config.outputFile().isPresent()) {
            writer.write(result, config.outputFile().get());
            LOGGER.info("Wrote {} results to {}", result.outcomes().size(), config.outputFile().get());
            return;
        }
        try {
            writer.write(result, System.out);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write results to standard output", ex);
        }
    }

    private static void importCache(TranslationCache cache, Path path) {
        if (!Files.exists(path)) {
            LOGGER.info("No translation cache at {}; starting empty", path);
            return;
        }
        try {
            cache.importCache(Files.readAllBytes(path));
            LOGGER.info("Loaded {} cached translations from {}", cache.size(), path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read translation cache " + path, ex);
        }
    }

    private static void exportCache(TranslationCache cache, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, cache.exportCache());
            LOGGER.info("Saved {} cached translations to {}", cache.size(), path);
        } catch (IOException ex) {
            LOGGER.warn("Failed to save translation cache to {}: {}", path, ex.getMessage());
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM is shutting down; abort hook already running");
        }
    }

    static Optional<FormulaLlmClient> createLlmClient(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = switch (translatorConfig.provider()) {
            case NONE -> null;
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
        if (chatModel == null) {
            LOGGER.info("LLM fallback disabled");
            return Optional.empty();
        }
        RetryPolicy retryPolicy = new RetryPolicy(translatorConfig.maxRetryAttempts(),
                Duration.ofSeconds(translatorConfig.initialBackoffSeconds()),
                Duration.ofSeconds(translatorConfig.maxBackoffSeconds()),
                translatorConfig.retryJitterFactor());
        return Optional.of(new ChatModelFormulaLlmClient(chatModel, translatorConfig.provider().name(),
                translatorConfig.modelName(), retryPolicy));
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.0)
                    .timeout(translatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.0)
                    .timeout(translatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
