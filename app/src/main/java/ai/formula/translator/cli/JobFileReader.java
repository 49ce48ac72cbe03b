package ai.formula.translator.cli;

import ai.formula.translator.formula.CellAddress;
import ai.formula.translator.locale.LocalePair;
import ai.formula.translator.rules.RuleSet;
import ai.formula.translator.structured.TableGeometry;
import ai.formula.translator.translate.FormulaJob;
import ai.formula.translator.translate.SheetContext;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the JSON job file: an array of {@code {cell, formula, sheet?, sourceLocale?, targetLocale?, tables?, sheetMapping?}}.
 */
public class JobFileReader {

    static final String DEFAULT_SHEET = "Sheet1";

    private final ObjectMapper objectMapper;

    public JobFileReader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    JobFileReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public List<FormulaJob> read(Path path, RuleSet ruleSet, String defaultSourceLocale, String defaultTargetLocale) {
        Objects.requireNonNull(path, "path");
        List<JobEntry> entries;
        try {
            entries = objectMapper.readValue(Files.readAllBytes(path), new TypeReference<List<JobEntry>>() { });
        } catch (JacksonException ex) {
            throw new IllegalArgumentException("Malformed job file " + path + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read job file " + path, ex);
        }
        List<FormulaJob> jobs = new ArrayList<>(entries == null ? 0 : entries.size());
        for (int index = 0; entries != null && index < entries.size(); index++) {
            try {
                jobs.add(toJob(entries.get(index), ruleSet, defaultSourceLocale, defaultTargetLocale));
            } catch (IllegalArgumentException | NullPointerException ex) {
                throw new IllegalArgumentException("Invalid job #" + (index + 1) + " in " + path + ": " + ex.getMessage(), ex);
            }
        }
        return jobs;
    }

    private FormulaJob toJob(JobEntry entry, RuleSet ruleSet, String defaultSourceLocale, String defaultTargetLocale) {
        if (entry == null || isBlank(entry.cell()) || entry.formula() == null) {
            throw new IllegalArgumentException("cell and formula are required");
        }
        CellAddress cell = CellAddress.parse(entry.cell());
        String sheet = !isBlank(entry.sheet()) ? entry.sheet() : cell.sheet().orElse(DEFAULT_SHEET);
        LocalePair localePair = LocalePair.of(
                ruleSet.requireLocale(isBlank(entry.sourceLocale()) ? defaultSourceLocale : entry.sourceLocale()),
                ruleSet.requireLocale(isBlank(entry.targetLocale()) ? defaultTargetLocale : entry.targetLocale()));
        List<TableGeometry> tables = new ArrayList<>();
        for (TableEntry table : entry.tables() == null ? List.<TableEntry>of() : entry.tables()) {
            tables.add(toGeometry(table, sheet));
        }
        return new FormulaJob(cell, entry.formula(), localePair, tables, new SheetContext(sheet, entry.sheetMapping()));
    }

    private static TableGeometry toGeometry(TableEntry table, String defaultSheet) {
        if (table.headerRow() == null || table.lastDataRow() == null || isBlank(table.anchorColumn())) {
            throw new IllegalArgumentException("table " + table.name() + " needs anchorColumn, headerRow and lastDataRow");
        }
        int firstDataRow = table.firstDataRow() == null ? table.headerRow() + 1 : table.firstDataRow();
        return new TableGeometry(table.name(),
                isBlank(table.sheet()) ? defaultSheet : table.sheet(),
                CellAddress.columnNumber(table.anchorColumn().trim()),
                table.headerRow(),
                firstDataRow,
                table.lastDataRow(),
                table.columns() == null ? List.of() : table.columns());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record JobEntry(String cell,
                    String formula,
                    String sheet,
                    String sourceLocale,
                    String targetLocale,
                    List<TableEntry> tables,
                    Map<String, String> sheetMapping) {
    }

    record TableEntry(String name,
                      String sheet,
                      String anchorColumn,
                      Integer headerRow,
                      Integer firstDataRow,
                      Integer lastDataRow,
                      List<String> columns) {
    }
}
