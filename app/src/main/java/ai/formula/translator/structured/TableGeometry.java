package ai.formula.translator.structured;

import ai.formula.translator.formula.CellAddress;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Position of a named table on its sheet.
 *
 * <p>Columns are laid out left to right starting at {@code anchorColumn}. Rows are one-based;
 * {@code headerRow} precedes the data rows {@code firstDataRow..lastDataRow}.</p>
 */
public record TableGeometry(String tableName,
                            String anchorSheet,
                            int anchorColumn,
                            int headerRow,
                            int firstDataRow,
                            int lastDataRow,
                            List<String> columnNames) {

    public TableGeometry {
        tableName = requireNonBlank(tableName, "tableName");
        anchorSheet = requireNonBlank(anchorSheet, "anchorSheet");
        if (anchorColumn < 1) {
            throw new IllegalArgumentException("anchorColumn must be positive for table " + tableName);
        }
        if (headerRow < 1 || firstDataRow <= headerRow) {
            throw new IllegalArgumentException("Data rows of table " + tableName + " must follow its header row");
        }
        if (lastDataRow < firstDataRow) {
            throw new IllegalArgumentException("Table " + tableName + " has no data rows");
        }
        Objects.requireNonNull(columnNames, "columnNames");
        if (columnNames.isEmpty()) {
            throw new IllegalArgumentException("Table " + tableName + " must declare at least one column");
        }
        Set<String> seen = new HashSet<>();
        for (String column : columnNames) {
            String name = requireNonBlank(column, "column name");
            if (!seen.add(name.toUpperCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate column " + name + " in table " + tableName);
            }
        }
        columnNames = List.copyOf(columnNames);
    }

    /**
     * Zero-based position of a column, matched case-insensitively.
     */
    public OptionalInt columnIndex(String columnName) {
        for (int index = 0; index < columnNames.size(); index++) {
            if (columnNames.get(index).equalsIgnoreCase(columnName.trim())) {
                return OptionalInt.of(index);
            }
        }
        return OptionalInt.empty();
    }

    public int sheetColumn(int columnIndex) {
        return anchorColumn + columnIndex;
    }

    public int lastColumn() {
        return sheetColumn(columnNames.size() - 1);
    }

    public boolean containsDataRow(int row) {
        return row >= firstDataRow && row <= lastDataRow;
    }

    public boolean isOnSheet(String sheetName) {
        return anchorSheet.equalsIgnoreCase(sheetName);
    }

    /**
     * True when the cell lies in the data body of this table.
     */
    public boolean containsDataCell(CellAddress cell) {
        return cell.isOnSheet(anchorSheet)
                && containsDataRow(cell.row())
                && cell.column() >= anchorColumn
                && cell.column() <= lastColumn();
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
