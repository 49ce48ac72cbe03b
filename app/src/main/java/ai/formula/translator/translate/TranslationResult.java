package ai.formula.translator.translate;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of translating one formula. The target text carries no leading {@code =}.
 */
public record TranslationResult(String targetFormulaText,
                                TranslationStatus status,
                                List<String> notes,
                                SortedSet<String> unmappedFunctions) {

    public TranslationResult {
        Objects.requireNonNull(targetFormulaText, "targetFormulaText");
        Objects.requireNonNull(status, "status");
        notes = notes == null ? List.of() : List.copyOf(notes);
        unmappedFunctions = unmappedFunctions == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(unmappedFunctions));
    }

    public static TranslationResult of(String targetFormulaText, TranslationStatus status,
                                       List<String> notes, Collection<String> unmappedFunctions) {
        return new TranslationResult(targetFormulaText, status, notes, new TreeSet<>(unmappedFunctions));
    }
}
