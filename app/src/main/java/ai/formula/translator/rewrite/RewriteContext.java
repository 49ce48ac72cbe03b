package ai.formula.translator.rewrite;

import ai.formula.translator.formula.FormulaTokenizer;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-formula inputs a rewrite template may draw on.
 *
 * @param sheetMapping       source sheet name to target sheet name
 * @param argumentSeparator  separator of the target locale
 * @param fragmentTokenizer  tokenizer for literal template text, configured for the target locale
 */
public record RewriteContext(Map<String, String> sheetMapping, char argumentSeparator, FormulaTokenizer fragmentTokenizer) {

    public RewriteContext {
        sheetMapping = sheetMapping == null ? Map.of() : Map.copyOf(sheetMapping);
        Objects.requireNonNull(fragmentTokenizer, "fragmentTokenizer");
    }

    public String targetSheet(String sourceSheet) {
        String mapped = sheetMapping.get(sourceSheet);
        if (mapped != null) {
            return mapped;
        }
        Optional<String> caseInsensitive = sheetMapping.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(sourceSheet))
                .map(Map.Entry::getValue)
                .findFirst();
        return caseInsensitive.orElse(sourceSheet);
    }
}
