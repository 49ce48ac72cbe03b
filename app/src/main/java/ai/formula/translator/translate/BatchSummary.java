package ai.formula.translator.translate;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Aggregate counts over a batch, used for the end-of-run report.
 */
public record BatchSummary(int translated,
                           int translatedWithFallback,
                           int unsupported,
                           int cacheHits,
                           SortedSet<String> unmappedFunctions) {

    public BatchSummary {
        unmappedFunctions = unmappedFunctions == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(unmappedFunctions));
    }

    public static BatchSummary from(List<JobOutcome> outcomes) {
        int translated = 0;
        int withFallback = 0;
        int unsupported = 0;
        int cacheHits = 0;
        SortedSet<String> unmapped = new TreeSet<>();
        for (JobOutcome outcome : outcomes) {
            switch (outcome.result().status()) {
                case TRANSLATED -> translated++;
                case TRANSLATED_WITH_FALLBACK -> withFallback++;
                case UNSUPPORTED -> unsupported++;
            }
            if (outcome.route() == TranslationRoute.CACHE_HIT) {
                cacheHits++;
            }
            unmapped.addAll(outcome.result().unmappedFunctions());
        }
        return new BatchSummary(translated, withFallback, unsupported, cacheHits, unmapped);
    }

    public int total() {
        return translated + translatedWithFallback + unsupported;
    }
}
