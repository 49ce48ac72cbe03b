package ai.formula.translator.rewrite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.formula.translator.formula.FormulaTokenizer;
import ai.formula.translator.formula.Token;
import ai.formula.translator.formula.TokenStream;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RewriteTemplateTest {

    private final FormulaTokenizer tokenizer = new FormulaTokenizer('.');

    @Test
    void reordersArgumentsWithTargetSeparator() {
        String rewritten = apply("{name}({3}{sep} {2}{sep} {1})", "IF(A1,\"x\",B2)", context(Map.of(), ';'));

        assertThat(rewritten).isEqualTo("IF(B2; \"x\"; A1)");
    }

    @Test
    void copiesArgumentRangesWithTheirSeparators() {
        assertThat(apply("CONCATENATE({args:2-})", "CONCAT(A1, B1,C1)", context(Map.of(), ','))).isEqualTo("CONCATENATE(B1,C1)");
        assertThat(apply("{name}({args:1-2})", "ROUND(A1,2)", context(Map.of(), ','))).isEqualTo("ROUND(A1,2)");
    }

    @Test
    void embedsStringContentInsideLiterals() {
        assertThat(apply("\"{text:2}!\"", "IF(A1,\"x\",B2)", context(Map.of(), ','))).isEqualTo("\"x!\"");
    }

    @Test
    void mapsAndQuotesSheetReferences() {
        String template = "\"{sheetRef:5}.\" & {name}({args:1-4})";

        assertThat(apply(template, "ADDRESS(10,5,1,1,\"Sheet1\")", context(Map.of("Sheet1", "Tabelle1"), ',')))
                .isEqualTo("\"Tabelle1.\" & ADDRESS(10,5,1,1)");
        assertThat(apply(template, "ADDRESS(1,2,1,1,\"My Sheet\")", context(Map.of(), ',')))
                .isEqualTo("\"'My Sheet'.\" & ADDRESS(1,2,1,1)");
    }

    @Test
    void reportsHighestArgument() {
        assertThat(RewriteTemplate.parse("\"{sheetRef:5}.\" & {name}({args:1-4})").highestArgument()).isEqualTo(5);
        assertThat(RewriteTemplate.parse("NOW()").highestArgument()).isZero();
    }

    @Test
    void rejectsMalformedTemplates() {
        assertThatThrownBy(() -> RewriteTemplate.parse("{name}({foo})"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown placeholder");
        assertThatThrownBy(() -> RewriteTemplate.parse("{args:3-1}")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RewriteTemplate.parse("{0}")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RewriteTemplate.parse("\"open {name}")).isInstanceOf(IllegalArgumentException.class);
    }

    private String apply(String template, String formula, RewriteContext context) {
        TokenStream tokens = tokenizer.tokenize(formula);
        CallNode node = CallNodeParser.parse(tokens).get(0);
        List<Token> replacement = RewriteTemplate.parse(template).instantiate(node, tokens, context);
        return tokens.splice(node.nameIndex(), node.closeIndex() + 1, replacement).text();
    }

    private RewriteContext context(Map<String, String> sheetMapping, char separator) {
        return new RewriteContext(sheetMapping, separator, tokenizer);
    }
}
