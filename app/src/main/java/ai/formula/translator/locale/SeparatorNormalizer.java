package ai.formula.translator.locale;

import ai.formula.translator.formula.Token;
import ai.formula.translator.formula.TokenKind;
import ai.formula.translator.formula.TokenStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites argument separators, decimal separators and array delimiters from the source locale into the
 * target locale.
 *
 * <p>Only separator tokens and number literals are touched; string literals, references and
 * every other token pass through unchanged. Inside array constants the column and row delimiters of the
 * source locale are replaced by those of the target locale.</p>
 */
public class SeparatorNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SeparatorNormalizer.class);

    public NormalizationResult normalize(TokenStream tokens, LocalePair localePair) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(localePair, "localePair");
        FormulaLocale source = localePair.source();
        FormulaLocale target = localePair.target();
        if (source.isAmbiguous() || target.isAmbiguous()) {
            LOGGER.debug("Skipping separator normalization for ambiguous locale pair {}", localePair);
            return new NormalizationResult(tokens,
                    List.of("Separators left unchanged: locale pair " + localePair + " is ambiguous"));
        }
        if (source.sharesSeparatorsWith(target)) {
            return new NormalizationResult(tokens, List.of());
        }

        Pattern sourceNumber = numberGrammar(source.decimalSeparator());
        Pattern targetNumber = numberGrammar(target.decimalSeparator());
        String argumentSeparator = String.valueOf(source.argumentSeparator());
        List<Token> rewritten = new ArrayList<>(tokens.size());
        List<String> notes = new ArrayList<>();
        int arrayDepth = 0;
        for (Token token : tokens) {
            switch (token.kind()) {
                case OPEN_ARRAY -> arrayDepth++;
                case CLOSE_ARRAY -> arrayDepth = Math.max(0, arrayDepth - 1);
                default -> {
                }
            }
            if (token.is(TokenKind.ARGUMENT_SEPARATOR) && arrayDepth > 0) {
                rewritten.add(rewriteArrayDelimiter(token, source, target, notes));
            } else if (token.is(TokenKind.ARGUMENT_SEPARATOR) && token.text().equals(argumentSeparator)) {
                rewritten.add(token.withText(String.valueOf(target.argumentSeparator())));
            } else if (token.is(TokenKind.NUMBER_LITERAL)) {
                rewritten.add(rewriteNumber(token, source, target, sourceNumber, targetNumber, notes));
            } else {
                rewritten.add(token);
            }
        }
        return new NormalizationResult(TokenStream.of(rewritten), notes);
    }

    private Token rewriteArrayDelimiter(Token token, FormulaLocale source, FormulaLocale target, List<String> notes) {
        char delimiter = token.text().charAt(0);
        if (delimiter == source.arrayColumnSeparator()) {
            return token.withText(String.valueOf(target.arrayColumnSeparator()));
        }
        if (delimiter == source.arrayRowSeparator()) {
            return token.withText(String.valueOf(target.arrayRowSeparator()));
        }
        if (delimiter != target.arrayColumnSeparator() && delimiter != target.arrayRowSeparator()) {
            notes.add("Array delimiter '" + delimiter + "' is not used by " + source.tag()
                    + " and was left unchanged");
        }
        return token;
    }

    private Token rewriteNumber(Token token, FormulaLocale source, FormulaLocale target,
                                Pattern sourceNumber, Pattern targetNumber, List<String> notes) {
        String text = token.text();
        if (sourceNumber.matcher(text).matches()) {
            return token.withText(text.replace(source.decimalSeparator(), target.decimalSeparator()));
        }
        if (!targetNumber.matcher(text).matches()) {
            notes.add("Number literal '" + text + "' does not match the " + source.tag()
                    + " number format and was left unchanged");
        }
        return token;
    }

    private static Pattern numberGrammar(char decimalSeparator) {
        String decimal = Pattern.quote(String.valueOf(decimalSeparator));
        return Pattern.compile("(?:[0-9]+(?:" + decimal + "[0-9]+)?|" + decimal + "[0-9]+)(?:[eE][+-]?[0-9]+)?");
    }
}
