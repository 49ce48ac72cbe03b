package ai.formula.translator.cli;

import ai.formula.translator.config.LlmProvider;
import picocli.CommandLine;

public class LlmProviderConverter implements CommandLine.ITypeConverter<LlmProvider> {
    @Override
    public LlmProvider convert(String value) {
        return LlmProvider.from(value);
    }
}
