package ai.formula.translator.cli;

import ai.formula.translator.structured.AddressingMode;
import picocli.CommandLine;

/**
 * Parses the {@code --reference-mode} option.
 */
public class AddressingModeConverter implements CommandLine.ITypeConverter<AddressingMode> {
    @Override
    public AddressingMode convert(String value) {
        return AddressingMode.from(value);
    }
}
