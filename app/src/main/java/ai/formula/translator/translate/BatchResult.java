package ai.formula.translator.translate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-cell outcomes of a batch in input order, with their summary.
 */
public record BatchResult(List<JobOutcome> outcomes, BatchSummary summary) {

    public BatchResult {
        outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
        Objects.requireNonNull(summary, "summary");
    }

    public static BatchResult of(List<JobOutcome> outcomes) {
        return new BatchResult(outcomes, BatchSummary.from(outcomes));
    }

    public Map<String, TranslationResult> resultsByCell() {
        Map<String, TranslationResult> results = new LinkedHashMap<>();
        for (JobOutcome outcome : outcomes) {
            results.put(outcome.cellAddress().toString(), outcome.result());
        }
        return results;
    }
}
