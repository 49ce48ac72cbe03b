package ai.formula.translator.translate;

import ai.formula.translator.formula.CellAddress;
import ai.formula.translator.locale.LocalePair;
import ai.formula.translator.structured.TableGeometry;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One formula to translate. The source text is given without the leading {@code =}; one is tolerated and stripped.
 */
public record FormulaJob(CellAddress cellAddress,
                         String sourceFormulaText,
                         LocalePair localePair,
                         List<TableGeometry> tables,
                         SheetContext sheetContext) {

    public FormulaJob {
        Objects.requireNonNull(sourceFormulaText, "sourceFormulaText");
        Objects.requireNonNull(localePair, "localePair");
        Objects.requireNonNull(sheetContext, "sheetContext");
        Objects.requireNonNull(cellAddress, "cellAddress");
        if (cellAddress.sheet().isEmpty()) {
            cellAddress = cellAddress.withSheet(sheetContext.sheetName());
        }
        tables = tables == null ? List.of() : List.copyOf(tables);
        Set<String> names = new HashSet<>();
        for (TableGeometry table : tables) {
            if (!names.add(table.tableName().toUpperCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate table geometry for " + table.tableName());
            }
        }
    }

    public static FormulaJob of(String cell, String formula, LocalePair localePair, SheetContext sheetContext) {
        return new FormulaJob(CellAddress.parse(cell), formula, localePair, List.of(), sheetContext);
    }

    public FormulaJob withTables(List<TableGeometry> geometries) {
        return new FormulaJob(cellAddress, sourceFormulaText, localePair, geometries, sheetContext);
    }

    /**
     * Source text trimmed and without a leading {@code =}.
     */
    public String normalizedSourceText() {
        String trimmed = sourceFormulaText.strip();
        return trimmed.startsWith("=") ? trimmed.substring(1).strip() : trimmed;
    }
}
