package ai.formula.translator.formula;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One-based sheet cell coordinate, optionally qualified by a sheet name.
 */
public record CellAddress(Optional<String> sheet, int column, int row) {

    private static final Pattern A1 = Pattern.compile(
            "(?:(?<sheet>'(?:[^']|'')+'|[^'!]+)!)?\\$?(?<column>[A-Za-z]{1,3})\\$?(?<row>[0-9]+)");

    public CellAddress {
        sheet = sheet == null ? Optional.empty() : sheet.filter(value -> !value.isBlank());
        if (column < 1 || column > FormulaTokenizer.MAX_COLUMN) {
            throw new IllegalArgumentException("column out of range: " + column);
        }
        if (row < 1) {
            throw new IllegalArgumentException("row must be positive: " + row);
        }
    }

    public static CellAddress of(String sheet, int column, int row) {
        return new CellAddress(Optional.ofNullable(sheet), column, row);
    }

    /**
     * Parses {@code B5}, {@code Sheet1!B5} or {@code 'My Sheet'!$B$5}.
     */
    public static CellAddress parse(String reference) {
        if (reference == null) {
            throw new IllegalArgumentException("Cell reference must not be null");
        }
        Matcher matcher = A1.matcher(reference.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid cell reference: " + reference);
        }
        String sheet = matcher.group("sheet");
        if (sheet != null && sheet.startsWith("'")) {
            sheet = sheet.substring(1, sheet.length() - 1).replace("''", "'");
        }
        return of(sheet, columnNumber(matcher.group("column")), Integer.parseInt(matcher.group("row")));
    }

    public CellAddress withSheet(String sheetName) {
        return of(sheetName, column, row);
    }

    public boolean isOnSheet(String sheetName) {
        return sheet.map(value -> value.equalsIgnoreCase(sheetName)).orElse(false);
    }

    /**
     * Unqualified A1 notation, e.g. {@code B5}.
     */
    public String toA1() {
        return columnName(column) + row;
    }

    @Override
    public String toString() {
        return sheet.map(name -> SheetNames.qualifier(name) + toA1()).orElseGet(this::toA1);
    }

    /**
     * Converts column letters ({@code A}, {@code AB}) to a one-based column number.
     */
    public static int columnNumber(String letters) {
        int result = 0;
        for (char letter : letters.toUpperCase(Locale.ROOT).toCharArray()) {
            if (letter < 'A' || letter > 'Z') {
                throw new IllegalArgumentException("Invalid column letters: " + letters);
            }
            result = result * 26 + (letter - 'A' + 1);
        }
        return result;
    }

    public static String columnName(int column) {
        if (column < 1) {
            throw new IllegalArgumentException("column must be positive: " + column);
        }
        StringBuilder builder = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            builder.append((char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return builder.reverse().toString();
    }
}
