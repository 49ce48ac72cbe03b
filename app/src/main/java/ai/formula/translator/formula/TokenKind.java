package ai.formula.translator.formula;

/**
 * Lexical categories produced by {@link FormulaTokenizer}.
 */
public enum TokenKind {
    FUNCTION_NAME,
    IDENTIFIER,
    CELL_REFERENCE,
    RANGE_REFERENCE,
    STRUCTURED_REFERENCE,
    STRING_LITERAL,
    NUMBER_LITERAL,
    BOOLEAN_LITERAL,
    ERROR_LITERAL,
    OPERATOR,
    ARGUMENT_SEPARATOR,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_ARRAY,
    CLOSE_ARRAY,
    WHITESPACE;

    public boolean isReference() {
        return this == CELL_REFERENCE || this == RANGE_REFERENCE || this == STRUCTURED_REFERENCE;
    }
}
