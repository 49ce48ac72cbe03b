package ai.formula.translator.mapping;

import ai.formula.translator.formula.TokenStream;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

public record MappingResult(TokenStream tokens, SortedSet<String> unmappedFunctions) {

    public MappingResult {
        Objects.requireNonNull(tokens, "tokens");
        unmappedFunctions = unmappedFunctions == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(unmappedFunctions));
    }

    public static MappingResult of(TokenStream tokens, Set<String> unmapped) {
        return new MappingResult(tokens, new TreeSet<>(unmapped));
    }

    public boolean isComplete() {
        return unmappedFunctions.isEmpty();
    }
}
