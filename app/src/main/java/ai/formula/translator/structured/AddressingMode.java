package ai.formula.translator.structured;

import ai.formula.translator.formula.CellAddress;
import java.util.Arrays;
import java.util.Locale;

/**
 * How resolved structured references pin their columns and rows.
 */
public enum AddressingMode {
    RELATIVE("relative", false, false),
    ABSOLUTE_COLUMN("absolute-column", true, false),
    ABSOLUTE("absolute", true, true);

    private final String value;
    private final boolean columnFixed;
    private final boolean rowFixed;

    AddressingMode(String value, boolean columnFixed, boolean rowFixed) {
        this.value = value;
        this.columnFixed = columnFixed;
        this.rowFixed = rowFixed;
    }

    public String value() {
        return value;
    }

    public String render(int column, int row) {
        return (columnFixed ? "$" : "") + CellAddress.columnName(column) + (rowFixed ? "$" : "") + row;
    }

    public static AddressingMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ABSOLUTE_COLUMN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(mode -> mode.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported reference mode: " + raw));
    }
}
