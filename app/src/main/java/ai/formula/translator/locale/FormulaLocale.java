package ai.formula.translator.locale;

import java.util.Objects;

/**
 * Spreadsheet formula dialect: a locale tag plus its argument and decimal separators and the column and
 * row delimiters used inside inline array constants.
 */
public record FormulaLocale(String tag, char argumentSeparator, char decimalSeparator,
                            char arrayColumnSeparator, char arrayRowSeparator) {

    public static final FormulaLocale EN_US = new FormulaLocale("en-US", ',', '.');
    public static final FormulaLocale DE_DE = new FormulaLocale("de-DE", ';', ',');

    public FormulaLocale {
        Objects.requireNonNull(tag, "tag");
        if (tag.isBlank()) {
            throw new IllegalArgumentException("Locale tag must not be blank");
        }
        tag = tag.trim();
        if (argumentSeparator != ',' && argumentSeparator != ';') {
            throw new IllegalArgumentException("Unsupported argument separator for " + tag + ": " + argumentSeparator);
        }
        if (decimalSeparator != '.' && decimalSeparator != ',') {
            throw new IllegalArgumentException("Unsupported decimal separator for " + tag + ": " + decimalSeparator);
        }
        if (arrayColumnSeparator != ',' && arrayColumnSeparator != '.' && arrayColumnSeparator != ';') {
            throw new IllegalArgumentException("Unsupported array column separator for " + tag + ": "
                    + arrayColumnSeparator);
        }
        if (arrayRowSeparator != ';' && arrayRowSeparator != ',') {
            throw new IllegalArgumentException("Unsupported array row separator for " + tag + ": " + arrayRowSeparator);
        }
        if (arrayColumnSeparator == arrayRowSeparator) {
            throw new IllegalArgumentException("Array column and row separators of " + tag + " must differ");
        }
        if (arrayColumnSeparator == decimalSeparator || arrayRowSeparator == decimalSeparator) {
            throw new IllegalArgumentException("Array separators of " + tag + " must differ from its decimal separator");
        }
    }

    /**
     * Locale with the conventional array delimiters: {@code ;} between rows and {@code ,} between
     * columns, or {@code .} between columns where the comma is the decimal separator.
     */
    public FormulaLocale(String tag, char argumentSeparator, char decimalSeparator) {
        this(tag, argumentSeparator, decimalSeparator, decimalSeparator == ',' ? '.' : ',', ';');
    }

    /**
     * A locale whose argument separator equals its decimal separator cannot be rewritten safely.
     */
    public boolean isAmbiguous() {
        return argumentSeparator == decimalSeparator;
    }

    /**
     * True when formulas written for this locale need no separator rewriting to read in {@code other}.
     */
    public boolean sharesSeparatorsWith(FormulaLocale other) {
        return argumentSeparator == other.argumentSeparator
                && decimalSeparator == other.decimalSeparator
                && arrayColumnSeparator == other.arrayColumnSeparator
                && arrayRowSeparator == other.arrayRowSeparator;
    }

    @Override
    public String toString() {
        return tag;
    }
}
