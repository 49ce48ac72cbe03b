package ai.formula.translator.formula;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits spreadsheet formula text into a {@link TokenStream}.
 *
 * <p>The tokenizer is lossless: concatenating the text of every produced token yields the input
 * exactly. Instances are immutable and safe to share between threads. The decimal separator is a
 * constructor argument because it decides whether {@code 1,5} is one number or two arguments, and
 * whether a {@code .} inside an array constant separates columns.</p>
 */
public final class FormulaTokenizer {

    static final int MAX_COLUMN = 16_384;

    private static final String SHEET = "(?:'(?:[^']|'')+'|\\$?[\\p{L}_][\\p{L}\\p{N}_]*)";
    private static final String QUALIFIER = "(?:" + SHEET + "[!.])?";
    private static final String NAME = "[\\p{L}_\\\\][\\p{L}\\p{N}_.\\\\]*";
    private static final String ROW = "\\$?[0-9]+";
    private static final String END = "(?![\\p{L}\\p{N}_.!(\\[\\\\])";

    private static final Pattern ERROR_LITERAL = Pattern.compile(
            "#(?:NULL!|DIV/0!|VALUE!|REF!|NAME\\?|NUM!|N/A|GETTING_DATA|SPILL!|CALC!)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_PREFIX = Pattern.compile(NAME + "(?=\\[)");

    private static final List<LexRule> REFERENCE_AND_NAME_RULES = List.of(
            new LexRule(Pattern.compile(QUALIFIER + cell("c1") + ":" + QUALIFIER + cell("c2") + END),
                    TokenKind.RANGE_REFERENCE, List.of("c1", "c2")),
            new LexRule(Pattern.compile(QUALIFIER + column("c1") + ":" + QUALIFIER + column("c2") + END),
                    TokenKind.RANGE_REFERENCE, List.of("c1", "c2")),
            new LexRule(Pattern.compile(QUALIFIER + ROW + ":" + QUALIFIER + ROW + END),
                    TokenKind.RANGE_REFERENCE, List.of()),
            new LexRule(Pattern.compile(QUALIFIER + cell("c1") + END),
                    TokenKind.CELL_REFERENCE, List.of("c1")),
            new LexRule(Pattern.compile(SHEET + "!" + NAME + END),
                    TokenKind.IDENTIFIER, List.of()),
            new LexRule(Pattern.compile(NAME + "(?=\\()"),
                    TokenKind.FUNCTION_NAME, List.of()));

    private static final List<LexRule> LITERAL_RULES = List.of(
            new LexRule(Pattern.compile("(?:TRUE|FALSE)" + END, Pattern.CASE_INSENSITIVE),
                    TokenKind.BOOLEAN_LITERAL, List.of()),
            new LexRule(Pattern.compile(NAME),
                    TokenKind.IDENTIFIER, List.of()));

    private final char decimalSeparator;
    private final Pattern numberPattern;

    public FormulaTokenizer(char decimalSeparator) {
        if (decimalSeparator == ';' || Character.isLetterOrDigit(decimalSeparator)) {
            throw new IllegalArgumentException("Unsupported decimal separator: " + decimalSeparator);
        }
        this.decimalSeparator = decimalSeparator;
        String decimal = Pattern.quote(String.valueOf(decimalSeparator));
        this.numberPattern = Pattern.compile(
                "(?:[0-9]+(?:" + decimal + "[0-9]+)?|" + decimal + "[0-9]+)(?:[eE][+-]?[0-9]+)?");
    }

    public char decimalSeparator() {
        return decimalSeparator;
    }

    /**
     * Tokenizes a complete formula (without the leading {@code =}), validating delimiter balance.
     */
    public TokenStream tokenize(String formula) {
        return scan(Objects.requireNonNull(formula, "formula"), true);
    }

    /**
     * Tokenizes a formula fragment such as a rewrite template piece; delimiters need not balance.
     */
    public TokenStream tokenizeFragment(String fragment) {
        return scan(Objects.requireNonNull(fragment, "fragment"), false);
    }

    private TokenStream scan(String text, boolean checkBalance) {
        List<Token> tokens = new ArrayList<>();
        Deque<Integer> openDelimiters = new ArrayDeque<>();
        int length = text.length();
        int position = 0;
        while (position < length) {
            char current = text.charAt(position);
            int end;
            TokenKind kind;
            if (Character.isWhitespace(current)) {
                end = position + 1;
                while (end < length && Character.isWhitespace(text.charAt(end))) {
                    end++;
                }
                kind = TokenKind.WHITESPACE;
            } else if (current == '"') {
                end = scanQuoted(text, position, '"');
                kind = TokenKind.STRING_LITERAL;
            } else if (current == '(' || current == '{') {
                openDelimiters.push(position);
                end = position + 1;
                kind = current == '(' ? TokenKind.OPEN_PAREN : TokenKind.OPEN_ARRAY;
            } else if (current == ')' || current == '}') {
                char expected = current == ')' ? '(' : '{';
                Integer opener = openDelimiters.peek();
                if (opener != null && text.charAt(opener) == expected) {
                    openDelimiters.pop();
                } else if (checkBalance) {
                    throw new LexException(LexException.Kind.UNBALANCED_DELIMITER, byteOffset(text, position),
                            "unexpected '" + current + "'");
                }
                end = position + 1;
                kind = current == ')' ? TokenKind.CLOSE_PAREN : TokenKind.CLOSE_ARRAY;
            } else if (current == ',' || current == ';' || isArrayColumnDot(text, current, openDelimiters)) {
                end = position + 1;
                kind = TokenKind.ARGUMENT_SEPARATOR;
            } else if (current == '[') {
                end = scanBrackets(text, position);
                kind = TokenKind.STRUCTURED_REFERENCE;
            } else if (current == ']') {
                if (checkBalance) {
                    throw new LexException(LexException.Kind.UNBALANCED_DELIMITER, byteOffset(text, position), "unexpected ']'");
                }
                end = position + 1;
                kind = TokenKind.OPERATOR;
            } else {
                Match match = matchWord(text, position);
                end = match.end();
                kind = match.kind();
            }
            tokens.add(new Token(kind, text.substring(position, end)));
            position = end;
        }
        if (checkBalance && !openDelimiters.isEmpty()) {
            int offset = openDelimiters.peek();
            throw new LexException(LexException.Kind.UNBALANCED_DELIMITER, byteOffset(text, offset),
                    "'" + text.charAt(offset) + "' is never closed");
        }
        return TokenStream.of(tokens);
    }

    /**
     * Comma-decimal locales delimit array columns with {@code .}, as in {@code {1,5.2}}.
     */
    private boolean isArrayColumnDot(String text, char current, Deque<Integer> openDelimiters) {
        if (current != '.' || decimalSeparator == '.') {
            return false;
        }
        Integer opener = openDelimiters.peek();
        return opener != null && text.charAt(opener) == '{';
    }

    private Match matchWord(String text, int position) {
        Match reference = firstMatch(REFERENCE_AND_NAME_RULES, text, position);
        if (reference != null) {
            return reference;
        }
        Matcher tablePrefix = TABLE_PREFIX.matcher(text).region(position, text.length());
        if (tablePrefix.lookingAt()) {
            return new Match(scanBrackets(text, tablePrefix.end()), TokenKind.STRUCTURED_REFERENCE);
        }
        Match literal = firstMatch(LITERAL_RULES, text, position);
        if (literal != null) {
            return literal;
        }
        char current = text.charAt(position);
        if (current == '\'') {
            return new Match(scanQuoted(text, position, '\''), TokenKind.STRING_LITERAL);
        }
        Matcher number = numberPattern.matcher(text).region(position, text.length());
        if (number.lookingAt()) {
            return new Match(number.end(), TokenKind.NUMBER_LITERAL);
        }
        if (current == '#') {
            Matcher error = ERROR_LITERAL.matcher(text).region(position, text.length());
            if (error.lookingAt()) {
                return new Match(error.end(), TokenKind.ERROR_LITERAL);
            }
        }
        if (position + 1 < text.length()) {
            String pair = text.substring(position, position + 2);
            if (pair.equals("<=") || pair.equals(">=") || pair.equals("<>")) {
                return new Match(position + 2, TokenKind.OPERATOR);
            }
        }
        return new Match(position + Character.charCount(text.codePointAt(position)), TokenKind.OPERATOR);
    }

    private static Match firstMatch(List<LexRule> rules, String text, int position) {
        for (LexRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(text).region(position, text.length());
            if (matcher.lookingAt() && columnsInRange(matcher, rule.columnGroups())) {
                return new Match(matcher.end(), rule.kind());
            }
        }
        return null;
    }

    private static boolean columnsInRange(Matcher matcher, List<String> columnGroups) {
        for (String group : columnGroups) {
            if (CellAddress.columnNumber(matcher.group(group)) > MAX_COLUMN) {
                return false;
            }
        }
        return true;
    }

    private static int scanQuoted(String text, int start, char quote) {
        int index = start + 1;
        while (index < text.length()) {
            if (text.charAt(index) == quote) {
                if (index + 1 < text.length() && text.charAt(index + 1) == quote) {
                    index += 2;
                    continue;
                }
                return index + 1;
            }
            index++;
        }
        throw new LexException(LexException.Kind.UNTERMINATED_LITERAL, byteOffset(text, start),
                "missing closing " + quote);
    }

    private static int scanBrackets(String text, int start) {
        int depth = 0;
        int index = start;
        while (index < text.length()) {
            char current = text.charAt(index);
            if (current == '\'') {
                index += 2;
                continue;
            }
            if (current == '[') {
                depth++;
            } else if (current == ']') {
                depth--;
                if (depth == 0) {
                    return index + 1;
                }
            }
            index++;
        }
        throw new LexException(LexException.Kind.UNBALANCED_DELIMITER, byteOffset(text, start), "'[' is never closed");
    }

    private static String cell(String group) {
        return "\\$?(?<" + group + ">[A-Za-z]{1,3})\\$?[0-9]+";
    }

    private static String column(String group) {
        return "\\$?(?<" + group + ">[A-Za-z]{1,3})";
    }

    private static int byteOffset(String text, int index) {
        return text.substring(0, index).getBytes(StandardCharsets.UTF_8).length;
    }

    private record LexRule(Pattern pattern, TokenKind kind, List<String> columnGroups) {
    }

    private record Match(int end, TokenKind kind) {
    }
}
