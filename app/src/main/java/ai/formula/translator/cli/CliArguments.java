package ai.formula.translator.cli;

import ai.formula.translator.config.LlmProvider;
import ai.formula.translator.config.LogFormat;
import ai.formula.translator.structured.AddressingMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "formula-translator", mixinStandardHelpOptions = true,
        description = "Translates spreadsheet formulas between locales and repairs known incompatibilities")
public class CliArguments {

    @CommandLine.Option(names = "--jobs", description = "JSON file listing the formulas to translate", paramLabel = "FILE")
    private Path jobsFile;

    @CommandLine.Option(names = "--output", description = "Where to write the results (default: standard output)", paramLabel = "FILE")
    private Path outputFile;

    @CommandLine.Option(names = "--rules", description = "Rule file overriding the bundled rules", paramLabel = "FILE")
    private Path rulesFile;

    @CommandLine.Option(names = "--cache", description = "Translation cache file, read at start and written at the end", paramLabel = "FILE")
    private Path cacheFile;

    @CommandLine.Option(names = "--source-locale", description = "Default source locale tag", paramLabel = "TAG")
    private String sourceLocale;

    @CommandLine.Option(names = "--target-locale", description = "Default target locale tag", paramLabel = "TAG")
    private String targetLocale;

    @CommandLine.Option(names = "--concurrency", description = "Number of formulas translated in parallel", paramLabel = "COUNT")
    private Integer maxConcurrency;

    @CommandLine.Option(names = "--max-rewrite-iterations", description = "Upper bound on rule applications per formula", paramLabel = "COUNT")
    private Integer maxRewriteIterations;

    @CommandLine.Option(names = "--reference-mode", converter = AddressingModeConverter.class,
            description = "Addressing of resolved table references: relative, absolute-column or absolute")
    private AddressingMode addressingMode;

    @CommandLine.Option(names = "--llm-provider", converter = LlmProviderConverter.class,
            description = "Fallback model provider: none, ollama or gemini")
    private LlmProvider llmProvider;

    @CommandLine.Option(names = "--no-llm", description = "Disable the language-model fallback")
    private boolean noLlm;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log per-formula pipeline details")
    private boolean verbose;

    public Path jobsFile() {
        return jobsFile;
    }

    public Path outputFile() {
        return outputFile;
    }

    public Path rulesFile() {
        return rulesFile;
    }

    public Path cacheFile() {
        return cacheFile;
    }

    public String sourceLocale() {
        return sourceLocale;
    }

    public String targetLocale() {
        return targetLocale;
    }

    public Integer maxConcurrency() {
        return maxConcurrency;
    }

    public Integer maxRewriteIterations() {
        return maxRewriteIterations;
    }

    public AddressingMode addressingMode() {
        return addressingMode;
    }

    public LlmProvider llmProvider() {
        return llmProvider;
    }

    public boolean noLlm() {
        return noLlm;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
