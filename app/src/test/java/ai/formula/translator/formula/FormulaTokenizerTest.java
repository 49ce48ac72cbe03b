package ai.formula.translator.formula;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FormulaTokenizerTest {

    private final FormulaTokenizer tokenizer = new FormulaTokenizer('.');

    @Test
    void splitsSimpleCall() {
        TokenStream tokens = tokenizer.tokenize("SUM(A1,A2)");

        assertThat(tokens.tokens()).containsExactly(
                Token.of(TokenKind.FUNCTION_NAME, "SUM"),
                Token.of(TokenKind.OPEN_PAREN, "("),
                Token.of(TokenKind.CELL_REFERENCE, "A1"),
                Token.of(TokenKind.ARGUMENT_SEPARATOR, ","),
                Token.of(TokenKind.CELL_REFERENCE, "A2"),
                Token.of(TokenKind.CLOSE_PAREN, ")"));
    }

    @Test
    void classifiesLiteralsAndOperators() {
        TokenStream tokens = tokenizer.tokenize("IF(A1>=10.5,\"Yes\",#N/A)<>TRUE");

        assertThat(tokens.stream().map(Token::kind).toList()).containsExactly(
                TokenKind.FUNCTION_NAME, TokenKind.OPEN_PAREN, TokenKind.CELL_REFERENCE, TokenKind.OPERATOR,
                TokenKind.NUMBER_LITERAL, TokenKind.ARGUMENT_SEPARATOR, TokenKind.STRING_LITERAL,
                TokenKind.ARGUMENT_SEPARATOR, TokenKind.ERROR_LITERAL, TokenKind.CLOSE_PAREN,
                TokenKind.OPERATOR, TokenKind.BOOLEAN_LITERAL);
        assertThat(tokens.get(3).text()).isEqualTo(">=");
        assertThat(tokens.get(4).text()).isEqualTo("10.5");
    }

    @Test
    void recognizesQualifiedReferencesAndRanges() {
        TokenStream tokens = tokenizer.tokenize("SUM('My Sheet'!$B$5,Sheet2!A1:B10,C:C,3:4)");

        assertThat(tokens.get(2)).isEqualTo(Token.of(TokenKind.CELL_REFERENCE, "'My Sheet'!$B$5"));
        assertThat(tokens.get(4)).isEqualTo(Token.of(TokenKind.RANGE_REFERENCE, "Sheet2!A1:B10"));
        assertThat(tokens.get(6)).isEqualTo(Token.of(TokenKind.RANGE_REFERENCE, "C:C"));
        assertThat(tokens.get(8)).isEqualTo(Token.of(TokenKind.RANGE_REFERENCE, "3:4"));
    }

    @Test
    void treatsNamesWithDigitsBeforeParenthesisAsFunctions() {
        TokenStream tokens = tokenizer.tokenize("LOG10(XFD1)+XFE1");

        assertThat(tokens.get(0)).isEqualTo(Token.of(TokenKind.FUNCTION_NAME, "LOG10"));
        assertThat(tokens.get(2)).isEqualTo(Token.of(TokenKind.CELL_REFERENCE, "XFD1"));
        assertThat(tokens.get(5)).isEqualTo(Token.of(TokenKind.IDENTIFIER, "XFE1"));
    }

    @Test
    void keepsStructuredReferencesWhole() {
        TokenStream tokens = tokenizer.tokenize("SUM(Sales[[#Headers],[Amount]])+[@Amount]");

        assertThat(tokens.get(2)).isEqualTo(Token.of(TokenKind.STRUCTURED_REFERENCE, "Sales[[#Headers],[Amount]]"));
        assertThat(tokens.get(5)).isEqualTo(Token.of(TokenKind.STRUCTURED_REFERENCE, "[@Amount]"));
    }

    @Test
    void tokenizesArrayConstants() {
        TokenStream tokens = tokenizer.tokenize("{1,2;3,4}");

        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.OPEN_ARRAY);
        assertThat(tokens.get(4)).isEqualTo(Token.of(TokenKind.ARGUMENT_SEPARATOR, ";"));
        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.CLOSE_ARRAY);
    }

    @Test
    @DisplayName("Reads '1,5' as one number when the comma is the decimal separator")
    void decimalCommaTokenizer() {
        TokenStream tokens = new FormulaTokenizer(',').tokenize("SUMME(1,5;2)");

        assertThat(tokens.tokens()).containsExactly(
                Token.of(TokenKind.FUNCTION_NAME, "SUMME"),
                Token.of(TokenKind.OPEN_PAREN, "("),
                Token.of(TokenKind.NUMBER_LITERAL, "1,5"),
                Token.of(TokenKind.ARGUMENT_SEPARATOR, ";"),
                Token.of(TokenKind.NUMBER_LITERAL, "2"),
                Token.of(TokenKind.CLOSE_PAREN, ")"));
    }

    @Test
    void decimalCommaTokenizerReadsDotAsArrayColumnDelimiter() {
        TokenStream tokens = new FormulaTokenizer(',').tokenize("{1,5.2}");

        assertThat(tokens.tokens()).containsExactly(
                Token.of(TokenKind.OPEN_ARRAY, "{"),
                Token.of(TokenKind.NUMBER_LITERAL, "1,5"),
                Token.of(TokenKind.ARGUMENT_SEPARATOR, "."),
                Token.of(TokenKind.NUMBER_LITERAL, "2"),
                Token.of(TokenKind.CLOSE_ARRAY, "}"));
    }

    @Test
    void leadingEqualsIsAnOperatorToken() {
        TokenStream tokens = tokenizer.tokenize("=A1");

        assertThat(tokens.get(0)).isEqualTo(Token.of(TokenKind.OPERATOR, "="));
    }

    @Test
    @DisplayName("Concatenated token text reproduces the input")
    void tokenizationIsLossless() {
        List<String> formulas = List.of(
                "SUM( A1 , 2 )",
                "=IF(A1=\"a \"\"quoted\"\" word\",  1.5e3 ,-B$2)",
                "INDIRECT(ADDRESS(10,5,1,1,\"Sheet1\"))",
                "VLOOKUP($A2,'Q1 Data'!$A:$D,4,FALSE)&\" €\"",
                "SUM(Table1[Amount])/COUNT(Table1[[#Data],[Amount]:[Tax]])",
                "{1,2;3,4}*2%",
                "  \tA1\n+ B1 ");

        for (String formula : formulas) {
            assertThat(tokenizer.tokenize(formula).text()).isEqualTo(formula);
        }
    }

    @Test
    void reportsUnterminatedStringWithOffset() {
        LexException error = catchThrowableOfType(() -> tokenizer.tokenize("IF(A1=\"open,0)"), LexException.class);

        assertThat(error.kind()).isEqualTo(LexException.Kind.UNTERMINATED_LITERAL);
        assertThat(error.offset()).isEqualTo(6);
    }

    @Test
    @DisplayName("Offsets count UTF-8 bytes, so 'ö' and 'ß' take two each")
    void reportsOffsetsInUtf8Bytes() {
        LexException error = catchThrowableOfType(() -> tokenizer.tokenize("\"Größe\"&\"x"), LexException.class);

        assertThat(error.kind()).isEqualTo(LexException.Kind.UNTERMINATED_LITERAL);
        assertThat(error.offset()).isEqualTo(10);
        assertThat(error).hasMessageStartingWith("UNTERMINATED_LITERAL at offset 10");
    }

    @Test
    void reportsUnbalancedParentheses() {
        LexException unclosed = catchThrowableOfType(() -> tokenizer.tokenize("SUM(A1"), LexException.class);
        LexException extra = catchThrowableOfType(() -> tokenizer.tokenize("SUM(A1))"), LexException.class);
        LexException bracket = catchThrowableOfType(() -> tokenizer.tokenize("A1]"), LexException.class);

        assertThat(unclosed.kind()).isEqualTo(LexException.Kind.UNBALANCED_DELIMITER);
        assertThat(unclosed.offset()).isEqualTo(3);
        assertThat(extra.offset()).isEqualTo(7);
        assertThat(bracket.offset()).isEqualTo(2);
    }

    @Test
    void fragmentsNeedNotBalance() {
        TokenStream tokens = tokenizer.tokenizeFragment("\"Sheet1.\" & (");

        assertThat(tokens.text()).isEqualTo("\"Sheet1.\" & (");
        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.OPEN_PAREN);
    }

    @Test
    void functionNamesAreUpperCasedInOrder() {
        TokenStream tokens = tokenizer.tokenize("if(sum(A1:A2)>0,Sum(B1),max(1))");

        assertThat(tokens.functionNames()).containsExactly("IF", "SUM", "MAX");
    }
}
