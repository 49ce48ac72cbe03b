package ai.formula.translator.mapping;

import ai.formula.translator.formula.Token;
import ai.formula.translator.formula.TokenKind;
import ai.formula.translator.formula.TokenStream;
import ai.formula.translator.locale.FormulaLocale;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Replaces function-name tokens with their target-locale names.
 *
 * <p>Names missing from the table stay as they are and are reported upper-cased in the result, so the
 * caller can decide whether to escalate.</p>
 */
public class FunctionNameMapper {

    private final FunctionMapTable table;

    public FunctionNameMapper(FunctionMapTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public MappingResult map(TokenStream tokens, FormulaLocale targetLocale) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(targetLocale, "targetLocale");
        List<Token> mapped = new ArrayList<>(tokens.size());
        Set<String> unmapped = new TreeSet<>();
        for (Token token : tokens) {
            if (!token.is(TokenKind.FUNCTION_NAME)) {
                mapped.add(token);
                continue;
            }
            Optional<String> targetName = table.lookup(token.text(), targetLocale.tag());
            if (targetName.isPresent()) {
                mapped.add(token.withText(targetName.get()));
            } else {
                unmapped.add(token.text().toUpperCase(Locale.ROOT));
                mapped.add(token);
            }
        }
        return MappingResult.of(TokenStream.of(mapped), unmapped);
    }

    public FunctionMapTable table() {
        return table;
    }
}
