package ai.formula.translator.formula;

import java.util.regex.Pattern;

/**
 * Quoting rules for sheet names used as reference qualifiers.
 */
public final class SheetNames {

    private static final Pattern PLAIN = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");
    private static final Pattern LOOKS_LIKE_CELL = Pattern.compile("[A-Za-z]{1,3}[0-9]+|[RrCc][0-9]*");

    private SheetNames() {
    }

    public static boolean needsQuotes(String sheetName) {
        return !PLAIN.matcher(sheetName).matches() || LOOKS_LIKE_CELL.matcher(sheetName).matches();
    }

    /**
     * Returns the sheet name, wrapped in single quotes with embedded quotes doubled when required.
     */
    public static String quoteIfNeeded(String sheetName) {
        if (!needsQuotes(sheetName)) {
            return sheetName;
        }
        return "'" + sheetName.replace("'", "''") + "'";
    }

    /**
     * Reference prefix such as {@code Sheet2!} or {@code 'Q1 Data'!}.
     */
    public static String qualifier(String sheetName) {
        return quoteIfNeeded(sheetName) + "!";
    }

    /**
     * Reference prefix in the target dialect, where the sheet is separated by a dot:
     * {@code Sheet2.} or {@code 'Q1 Data'.}.
     */
    public static String calcQualifier(String sheetName) {
        return quoteIfNeeded(sheetName) + ".";
    }
}
