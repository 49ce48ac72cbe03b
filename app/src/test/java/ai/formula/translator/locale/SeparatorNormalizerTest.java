package ai.formula.translator.locale;

import static org.assertj.core.api.Assertions.assertThat;

import ai.formula.translator.formula.FormulaTokenizer;
import ai.formula.translator.formula.TokenStream;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeparatorNormalizerTest {

    private static final LocalePair EN_TO_DE = LocalePair.of(FormulaLocale.EN_US, FormulaLocale.DE_DE);

    private final SeparatorNormalizer normalizer = new SeparatorNormalizer();
    private final FormulaTokenizer tokenizer = new FormulaTokenizer('.');

    @Test
    void rewritesArgumentAndDecimalSeparators() {
        NormalizationResult result = normalizer.normalize(tokenizer.tokenize("IF(A1>0.5,1.25,\"a,b\")"), EN_TO_DE);

        assertThat(result.tokens().text()).isEqualTo("IF(A1>0,5;1,25;\"a,b\")");
        assertThat(result.notes()).isEmpty();
    }

    @Test
    void rewritesArrayColumnAndRowDelimiters() {
        NormalizationResult result = normalizer.normalize(tokenizer.tokenize("SUM({1.5,2},3)"), EN_TO_DE);

        assertThat(result.tokens().text()).isEqualTo("SUM({1,5.2};3)");
        assertThat(result.notes()).isEmpty();
    }

    @Test
    void keepsRowsApartInTwoDimensionalArrays() {
        NormalizationResult result = normalizer.normalize(tokenizer.tokenize("MMULT({1,2;3,4},A1:B2)"), EN_TO_DE);

        assertThat(result.tokens().text()).isEqualTo("MMULT({1.2;3.4};A1:B2)");
    }

    @Test
    void readsGermanArraysBackIntoEnglish() {
        LocalePair deToEn = LocalePair.of(FormulaLocale.DE_DE, FormulaLocale.EN_US);
        TokenStream tokens = new FormulaTokenizer(',').tokenize("SUMME({1,5.2;3.4};3)");

        NormalizationResult result = normalizer.normalize(tokens, deToEn);

        assertThat(result.tokens().text()).isEqualTo("SUMME({1.5,2;3,4},3)");
        assertThat(result.notes()).isEmpty();
    }

    @Test
    void localesDifferingOnlyInArrayDelimitersAreStillRewritten() {
        FormulaLocale swapped = new FormulaLocale("xx-XX", ',', '.', ';', ',');

        NormalizationResult result = normalizer.normalize(tokenizer.tokenize("SUM({1,2;3,4})"),
                LocalePair.of(FormulaLocale.EN_US, swapped));

        assertThat(result.tokens().text()).isEqualTo("SUM({1;2,3;4})");
    }

    @Test
    void applyingTheSamePairTwiceChangesNothing() {
        List<String> formulas = List.of("SUM(A1,A2)", "ROUND(2.5,0)*1.5e2", "IF(A1,{1,2},\"x\")", "0.25");

        for (String formula : formulas) {
            TokenStream once = normalizer.normalize(tokenizer.tokenize(formula), EN_TO_DE).tokens();
            TokenStream twice = normalizer.normalize(once, EN_TO_DE).tokens();
            assertThat(twice).isEqualTo(once);
        }
    }

    @Test
    void ambiguousLocaleIsANoOpWithNote() {
        FormulaLocale ambiguous = new FormulaLocale("xx-XX", ',', ',');
        TokenStream tokens = tokenizer.tokenize("SUM(1.5,2)");

        NormalizationResult result = normalizer.normalize(tokens, LocalePair.of(FormulaLocale.EN_US, ambiguous));

        assertThat(result.tokens()).isEqualTo(tokens);
        assertThat(result.notes()).singleElement().satisfies(note -> assertThat(note).contains("ambiguous"));
    }

    @Test
    void identicalSeparatorsAreANoOp() {
        TokenStream tokens = tokenizer.tokenize("SUM(1.5,2)");

        NormalizationResult result = normalizer.normalize(tokens, LocalePair.of(FormulaLocale.EN_US, FormulaLocale.EN_US));

        assertThat(result.tokens()).isSameAs(tokens);
        assertThat(result.notes()).isEmpty();
    }
}
