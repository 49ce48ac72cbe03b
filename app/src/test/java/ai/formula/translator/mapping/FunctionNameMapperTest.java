package ai.formula.translator.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.formula.translator.formula.FormulaTokenizer;
import ai.formula.translator.locale.FormulaLocale;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FunctionNameMapperTest {

    private static final FunctionMapTable TABLE = FunctionMapTable.of(List.of(
            new FunctionMapEntry("SUM", Map.of("en-US", "SUM", "de-DE", "SUMME")),
            new FunctionMapEntry("IF", Map.of("en-US", "IF", "de-DE", "WENN")),
            new FunctionMapEntry("MAX", Map.of("en-US", "MAX", "de-DE", "MAX"))));

    private final FunctionNameMapper mapper = new FunctionNameMapper(TABLE);
    private final FormulaTokenizer tokenizer = new FormulaTokenizer('.');

    @Test
    void mapsEveryKnownFunctionRegardlessOfCaseOrPosition() {
        MappingResult result = mapper.map(tokenizer.tokenize("sum(A1,IF(A2,SUM(B1),Max(1)))"), FormulaLocale.DE_DE);

        assertThat(result.tokens().text()).isEqualTo("SUMME(A1,WENN(A2,SUMME(B1),MAX(1)))");
        assertThat(result.isComplete()).isTrue();
    }

    @Test
    void leavesUnknownFunctionsAndReportsThem() {
        MappingResult result = mapper.map(tokenizer.tokenize("XLOOKUP(A1,B:B,C:C)+foo(1)+SUM(2)"), FormulaLocale.DE_DE);

        assertThat(result.tokens().text()).isEqualTo("XLOOKUP(A1,B:B,C:C)+foo(1)+SUMME(2)");
        assertThat(result.unmappedFunctions()).containsExactly("FOO", "XLOOKUP");
        assertThat(result.isComplete()).isFalse();
    }

    @Test
    void looksUpInBothDirections() {
        assertThat(TABLE.lookup("summe", "en-US")).contains("SUM");
        assertThat(TABLE.lookup("WENN", "de-DE")).contains("WENN");
        assertThat(TABLE.lookup("SUM", "fr-FR")).isEmpty();
        assertThat(TABLE.supports("if", "de-DE")).isTrue();
        assertThat(TABLE.locales()).containsExactlyInAnyOrder("en-US", "de-DE");
    }

    @Test
    void doesNotTouchNonFunctionTokens() {
        MappingResult result = mapper.map(tokenizer.tokenize("\"SUM(1)\"&SUM"), FormulaLocale.DE_DE);

        assertThat(result.tokens().text()).isEqualTo("\"SUM(1)\"&SUM");
    }

    @Test
    void rejectsNamesSharedByDifferentFunctions() {
        assertThatThrownBy(() -> FunctionMapTable.of(List.of(
                new FunctionMapEntry("SUM", Map.of("de-DE", "SUMME")),
                new FunctionMapEntry("TOTAL", Map.of("de-DE", "SUMME")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SUMME");
    }
}
