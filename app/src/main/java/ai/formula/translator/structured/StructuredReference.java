package ai.formula.translator.structured;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed form of a structured reference such as {@code Sales[[#This Row],[Amount]]}.
 */
public record StructuredReference(String text,
                                  Optional<String> tableName,
                                  Set<ItemSpecifier> items,
                                  Optional<String> firstColumn,
                                  Optional<String> lastColumn) {

    public enum ItemSpecifier {
        ALL("#All"),
        DATA("#Data"),
        HEADERS("#Headers"),
        TOTALS("#Totals"),
        THIS_ROW("#This Row");

        private final String keyword;

        ItemSpecifier(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        static Optional<ItemSpecifier> fromKeyword(String raw) {
            String normalized = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(item -> item.keyword.toLowerCase(Locale.ROOT).equals(normalized))
                    .findFirst();
        }
    }

    public StructuredReference {
        Objects.requireNonNull(text, "text");
        tableName = tableName == null ? Optional.empty() : tableName.filter(name -> !name.isBlank());
        items = items == null || items.isEmpty() ? Set.of() : Set.copyOf(items);
        firstColumn = firstColumn == null ? Optional.empty() : firstColumn;
        lastColumn = lastColumn == null ? Optional.empty() : lastColumn;
        if (lastColumn.isPresent() && firstColumn.isEmpty()) {
            throw new IllegalArgumentException("Column range without a first column: " + text);
        }
    }

    /**
     * Parses the text of a {@code STRUCTURED_REFERENCE} token.
     *
     * @throws ResolveException with kind {@code MALFORMED_REFERENCE} when the text is not a structured reference
     */
    public static StructuredReference parse(String text) {
        int open = text.indexOf('[');
        if (open < 0 || !text.endsWith("]")) {
            throw malformed(text, "missing brackets");
        }
        String table = text.substring(0, open).trim();
        String inner = text.substring(open + 1, text.length() - 1).trim();
        Set<ItemSpecifier> items = EnumSet.noneOf(ItemSpecifier.class);
        List<String> columns = new ArrayList<>();
        boolean columnRange = false;

        if (inner.startsWith("@")) {
            items.add(ItemSpecifier.THIS_ROW);
            String rest = inner.substring(1).trim();
            if (rest.startsWith("[")) {
                columnRange = collectSegments(text, rest, items, columns);
            } else if (!rest.isEmpty()) {
                columns.add(unescape(rest));
            }
        } else if (inner.startsWith("[")) {
            columnRange = collectSegments(text, inner, items, columns);
        } else if (inner.startsWith("#")) {
            items.add(ItemSpecifier.fromKeyword(inner)
                    .orElseThrow(() -> malformed(text, "unknown item specifier " + inner)));
        } else if (!inner.isEmpty()) {
            columns.add(unescape(inner));
        }

        if (columns.size() > 2 || (columns.size() == 2 && !columnRange)) {
            throw malformed(text, "expected a single column or a column range");
        }
        Optional<String> first = columns.isEmpty() ? Optional.empty() : Optional.of(columns.get(0));
        Optional<String> last = columns.size() == 2 ? Optional.of(columns.get(1)) : Optional.empty();
        return new StructuredReference(text, Optional.of(table), items, first, last);
    }

    private static boolean collectSegments(String text, String list, Set<ItemSpecifier> items, List<String> columns) {
        boolean columnRange = false;
        int position = 0;
        while (position < list.length()) {
            position = skipSpaces(list, position);
            if (position >= list.length() || list.charAt(position) != '[') {
                throw malformed(text, "expected '[' at " + position);
            }
            int close = closingBracket(list, position);
            if (close < 0) {
                throw malformed(text, "unterminated segment");
            }
            String segment = list.substring(position + 1, close).trim();
            if (segment.startsWith("#")) {
                items.add(ItemSpecifier.fromKeyword(segment)
                        .orElseThrow(() -> malformed(text, "unknown item specifier " + segment)));
            } else if (segment.startsWith("@")) {
                items.add(ItemSpecifier.THIS_ROW);
                if (segment.length() > 1) {
                    columns.add(unescape(segment.substring(1).trim()));
                }
            } else if (segment.isEmpty()) {
                throw malformed(text, "empty column name");
            } else {
                columns.add(unescape(segment));
            }
            position = skipSpaces(list, close + 1);
            if (position < list.length()) {
                char separator = list.charAt(position);
                if (separator == ':') {
                    columnRange = true;
                } else if (separator != ',' && separator != ';') {
                    throw malformed(text, "unexpected '" + separator + "'");
                }
                position++;
            }
        }
        return columnRange;
    }

    private static int closingBracket(String list, int open) {
        int index = open + 1;
        while (index < list.length()) {
            char current = list.charAt(index);
            if (current == '\'') {
                index += 2;
                continue;
            }
            if (current == ']') {
                return index;
            }
            index++;
        }
        return -1;
    }

    private static int skipSpaces(String value, int position) {
        int index = position;
        while (index < value.length() && Character.isWhitespace(value.charAt(index))) {
            index++;
        }
        return index;
    }

    private static String unescape(String columnName) {
        return columnName.replaceAll("'(.)", "$1");
    }

    private static ResolveException malformed(String text, String detail) {
        return new ResolveException(ResolveException.Kind.MALFORMED_REFERENCE, text, detail);
    }
}
