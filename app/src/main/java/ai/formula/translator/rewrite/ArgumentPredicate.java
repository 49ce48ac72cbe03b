package ai.formula.translator.rewrite;

import ai.formula.translator.formula.Token;
import ai.formula.translator.formula.TokenKind;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Condition on the (whitespace-trimmed) tokens of a single call argument.
 */
public enum ArgumentPredicate {
    ANY("any") {
        @Override
        public boolean test(List<Token> argument) {
            return true;
        }
    },
    EMPTY("empty") {
        @Override
        public boolean test(List<Token> argument) {
            return argument.isEmpty();
        }
    },
    NOT_EMPTY("not-empty") {
        @Override
        public boolean test(List<Token> argument) {
            return !argument.isEmpty();
        }
    },
    STRING_LITERAL("string-literal") {
        @Override
        public boolean test(List<Token> argument) {
            return argument.size() == 1 && argument.get(0).is(TokenKind.STRING_LITERAL);
        }
    },
    NUMBER_LITERAL("number-literal") {
        @Override
        public boolean test(List<Token> argument) {
            if (argument.size() == 1) {
                return argument.get(0).is(TokenKind.NUMBER_LITERAL);
            }
            return argument.size() == 2
                    && argument.get(0).is(TokenKind.OPERATOR)
                    && (argument.get(0).text().equals("-") || argument.get(0).text().equals("+"))
                    && argument.get(1).is(TokenKind.NUMBER_LITERAL);
        }
    },
    REFERENCE("reference") {
        @Override
        public boolean test(List<Token> argument) {
            return argument.size() == 1 && argument.get(0).kind().isReference();
        }
    },
    FUNCTION_CALL("function-call") {
        @Override
        public boolean test(List<Token> argument) {
            if (argument.size() < 3
                    || !argument.get(0).is(TokenKind.FUNCTION_NAME)
                    || !argument.get(1).is(TokenKind.OPEN_PAREN)) {
                return false;
            }
            int depth = 0;
            for (int index = 1; index < argument.size(); index++) {
                TokenKind kind = argument.get(index).kind();
                if (kind == TokenKind.OPEN_PAREN) {
                    depth++;
                } else if (kind == TokenKind.CLOSE_PAREN) {
                    depth--;
                    if (depth == 0) {
                        return index == argument.size() - 1;
                    }
                }
            }
            return false;
        }
    };

    private final String value;

    ArgumentPredicate(String value) {
        this.value = value;
    }

    public abstract boolean test(List<Token> argument);

    public String value() {
        return value;
    }

    public static ArgumentPredicate from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANY;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(predicate -> predicate.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported argument predicate: " + raw));
    }
}
