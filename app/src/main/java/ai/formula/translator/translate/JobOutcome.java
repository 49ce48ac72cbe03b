package ai.formula.translator.translate;

import ai.formula.translator.formula.CellAddress;
import java.util.Objects;

public record JobOutcome(CellAddress cellAddress, TranslationRoute route, TranslationResult result) {

    public JobOutcome {
        Objects.requireNonNull(cellAddress, "cellAddress");
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(result, "result");
    }
}
