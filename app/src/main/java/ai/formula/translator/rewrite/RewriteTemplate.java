package ai.formula.translator.rewrite;

import ai.formula.translator.formula.FormulaTokenizer;
import ai.formula.translator.formula.LexException;
import ai.formula.translator.formula.SheetNames;
import ai.formula.translator.formula.Token;
import ai.formula.translator.formula.TokenKind;
import ai.formula.translator.formula.TokenStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replacement text for a matched call.
 *
 * <p>Placeholders:</p>
 * <ul>
 *   <li>{@code {name}} the matched function name token</li>
 *   <li>{@code {n}} the tokens of argument {@code n}</li>
 *   <li>{@code {args:a-b}} arguments {@code a} to {@code b} with their separators; {@code {args:a-}} runs to the last argument</li>
 *   <li>{@code {text:n}} the inner text of string argument {@code n}, for use inside a string literal</li>
 *   <li>{@code {sheetRef:n}} string argument {@code n} read as a sheet name, mapped, quoted if needed and escaped for a string literal</li>
 *   <li>{@code {sep}} the target argument separator</li>
 * </ul>
 * <p>Argument tokens are relocated as-is. Literal template text is lexed as a fragment.</p>
 */
public final class RewriteTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+(?::[^{}]*)?|[0-9]+)}");
    private static final Pattern ARGUMENT_RANGE = Pattern.compile("([0-9]+)-([0-9]*)");
    private static final FormulaTokenizer VALIDATION_TOKENIZER = new FormulaTokenizer('.');

    private final String source;
    private final List<Part> parts;

    private RewriteTemplate(String source, List<Part> parts) {
        this.source = source;
        this.parts = List.copyOf(parts);
    }

    public static RewriteTemplate parse(String template) {
        Objects.requireNonNull(template, "template");
        if (template.isBlank()) {
            throw new IllegalArgumentException("Rewrite template must not be blank");
        }
        List<Part> parts = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() > position) {
                parts.add(new Literal(template.substring(position, matcher.start())));
            }
            parts.add(placeholder(template, matcher.group(1)));
            position = matcher.end();
        }
        if (position < template.length()) {
            parts.add(new Literal(template.substring(position)));
        }
        RewriteTemplate parsed = new RewriteTemplate(template, parts);
        parsed.validateLiteralRuns();
        return parsed;
    }

    private static Part placeholder(String template, String body) {
        if (body.chars().allMatch(Character::isDigit)) {
            return new Argument(position(template, body));
        }
        int colon = body.indexOf(':');
        String name = colon < 0 ? body : body.substring(0, colon);
        String value = colon < 0 ? "" : body.substring(colon + 1).trim();
        switch (name) {
            case "name":
                return new FunctionName();
            case "sep":
                return new Separator();
            case "text":
                return new ArgumentText(position(template, value));
            case "sheetRef":
                return new SheetReference(position(template, value));
            case "args":
                Matcher range = ARGUMENT_RANGE.matcher(value);
                if (!range.matches()) {
                    throw new IllegalArgumentException("Invalid argument range {" + body + "} in template " + template);
                }
                int from = position(template, range.group(1));
                int to = range.group(2).isEmpty() ? Integer.MAX_VALUE : position(template, range.group(2));
                if (to < from) {
                    throw new IllegalArgumentException("Empty argument range {" + body + "} in template " + template);
                }
                return new ArgumentRange(from, to);
            default:
                throw new IllegalArgumentException("Unknown placeholder {" + body + "} in template " + template);
        }
    }

    private static int position(String template, String value) {
        try {
            int position = Integer.parseInt(value);
            if (position < 1) {
                throw new IllegalArgumentException("Argument positions are one-based in template " + template);
            }
            return position;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid argument position '" + value + "' in template " + template, ex);
        }
    }

    private void validateLiteralRuns() {
        StringBuilder run = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof Literal literal) {
                run.append(literal.text());
            } else if (part instanceof ArgumentText || part instanceof SheetReference) {
                run.append('x');
            } else if (part instanceof Separator) {
                run.append(',');
            } else {
                lexRun(run);
            }
        }
        lexRun(run);
    }

    private void lexRun(StringBuilder run) {
        try {
            VALIDATION_TOKENIZER.tokenizeFragment(run.toString());
        } catch (LexException ex) {
            throw new IllegalArgumentException("Template " + source + " contains unlexable text: " + ex.getMessage(), ex);
        }
        run.setLength(0);
    }

    public String source() {
        return source;
    }

    /**
     * Highest argument position the template reads, or 0 when it reads none.
     */
    public int highestArgument() {
        int highest = 0;
        for (Part part : parts) {
            if (part instanceof Argument argument) {
                highest = Math.max(highest, argument.position());
            } else if (part instanceof ArgumentText text) {
                highest = Math.max(highest, text.position());
            } else if (part instanceof SheetReference sheet) {
                highest = Math.max(highest, sheet.position());
            } else if (part instanceof ArgumentRange range) {
                highest = Math.max(highest, range.from());
            }
        }
        return highest;
    }

    /**
     * Produces the tokens that replace {@code node} (name through closing parenthesis).
     */
    public List<Token> instantiate(CallNode node, TokenStream tokens, RewriteContext context) {
        List<Token> output = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof Literal literal) {
                pending.append(literal.text());
            } else if (part instanceof Separator) {
                pending.append(context.argumentSeparator());
            } else if (part instanceof ArgumentText text) {
                pending.append(stringContent(node, tokens, text.position()));
            } else if (part instanceof SheetReference sheet) {
                String sheetName = unescapeString(stringContent(node, tokens, sheet.position()));
                String target = SheetNames.quoteIfNeeded(context.targetSheet(sheetName));
                pending.append(target.replace("\"", "\"\""));
            } else {
                flush(pending, output, context);
                if (part instanceof FunctionName) {
                    output.add(tokens.get(node.nameIndex()));
                } else if (part instanceof Argument argument) {
                    output.addAll(argumentTokens(node, tokens, argument.position(), argument.position()));
                } else if (part instanceof ArgumentRange range) {
                    output.addAll(argumentTokens(node, tokens, range.from(), range.to()));
                }
            }
        }
        flush(pending, output, context);
        return output;
    }

    private static void flush(StringBuilder pending, List<Token> output, RewriteContext context) {
        if (pending.length() == 0) {
            return;
        }
        output.addAll(context.fragmentTokenizer().tokenizeFragment(pending.toString()).tokens());
        pending.setLength(0);
    }

    private static List<Token> argumentTokens(CallNode node, TokenStream tokens, int from, int to) {
        int arity = node.arity(tokens);
        if (from > arity) {
            return List.of();
        }
        int last = Math.min(to, arity);
        int start = node.arguments().get(from - 1).start();
        int end = node.arguments().get(last - 1).end();
        return CallNode.significant(tokens, new CallNode.Span(start, end));
    }

    private static String stringContent(CallNode node, TokenStream tokens, int position) {
        if (position > node.arity(tokens)) {
            return "";
        }
        List<Token> argument = node.argument(tokens, position);
        if (argument.size() == 1 && argument.get(0).is(TokenKind.STRING_LITERAL)) {
            String literal = argument.get(0).text();
            return literal.substring(1, literal.length() - 1);
        }
        StringBuilder raw = new StringBuilder();
        argument.forEach(token -> raw.append(token.text()));
        return raw.toString().replace("\"", "\"\"");
    }

    private static String unescapeString(String content) {
        return content.replace("\"\"", "\"");
    }

    @Override
    public String toString() {
        return source;
    }

    private interface Part {
    }

    private record Literal(String text) implements Part {
    }

    private record FunctionName() implements Part {
    }

    private record Separator() implements Part {
    }

    private record Argument(int position) implements Part {
    }

    private record ArgumentRange(int from, int to) implements Part {
    }

    private record ArgumentText(int position) implements Part {
    }

    private record SheetReference(int position) implements Part {
    }
}
