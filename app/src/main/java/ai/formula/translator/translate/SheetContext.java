package ai.formula.translator.translate;

import java.util.Map;

/**
 * Sheet a formula lives on, plus the source-to-target sheet name mapping used when rewrites re-emit sheet names.
 */
public record SheetContext(String sheetName, Map<String, String> sheetMapping) {

    public SheetContext {
        if (sheetName == null || sheetName.isBlank()) {
            throw new IllegalArgumentException("sheetName must not be blank");
        }
        sheetMapping = sheetMapping == null ? Map.of() : Map.copyOf(sheetMapping);
    }

    public static SheetContext of(String sheetName) {
        return new SheetContext(sheetName, Map.of());
    }
}
