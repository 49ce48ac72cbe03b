package ai.formula.translator.structured;

import ai.formula.translator.formula.CellAddress;
import ai.formula.translator.formula.SheetNames;
import ai.formula.translator.formula.Token;
import ai.formula.translator.formula.TokenKind;
import ai.formula.translator.formula.TokenStream;
import ai.formula.translator.structured.StructuredReference.ItemSpecifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Replaces structured references with plain cell or range references using the supplied table geometry.
 */
public class StructuredReferenceResolver {

    private final AddressingMode addressingMode;

    public StructuredReferenceResolver() {
        this(AddressingMode.ABSOLUTE_COLUMN);
    }

    public StructuredReferenceResolver(AddressingMode addressingMode) {
        this.addressingMode = Objects.requireNonNull(addressingMode, "addressingMode");
    }

    public AddressingMode addressingMode() {
        return addressingMode;
    }

    /**
     * Resolves every structured reference in {@code tokens}; all other tokens are returned unchanged.
     *
     * @throws ResolveException when a reference names an unknown table or column, or needs an enclosing
     *                          table the current cell does not belong to
     */
    public TokenStream resolve(TokenStream tokens, Collection<TableGeometry> tables, CellAddress currentCell) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(currentCell, "currentCell");
        if (!tokens.contains(TokenKind.STRUCTURED_REFERENCE)) {
            return tokens;
        }
        List<Token> resolved = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            resolved.add(token.is(TokenKind.STRUCTURED_REFERENCE)
                    ? resolveReference(token.text(), tables, currentCell)
                    : token);
        }
        return TokenStream.of(resolved);
    }

    private Token resolveReference(String text, Collection<TableGeometry> tables, CellAddress currentCell) {
        StructuredReference reference = StructuredReference.parse(text);
        TableGeometry table = reference.tableName()
                .map(name -> findTable(text, name, tables))
                .orElseGet(() -> enclosingTable(text, tables, currentCell));

        int firstColumn = table.anchorColumn();
        int lastColumn = table.lastColumn();
        if (reference.firstColumn().isPresent()) {
            firstColumn = table.sheetColumn(columnIndex(text, table, reference.firstColumn().get()));
            lastColumn = reference.lastColumn()
                    .map(name -> table.sheetColumn(columnIndex(text, table, name)))
                    .orElse(firstColumn);
            if (lastColumn < firstColumn) {
                int swap = firstColumn;
                firstColumn = lastColumn;
                lastColumn = swap;
            }
        }

        int[] rows = rowSpan(text, reference.items(), table, currentCell);
        String prefix = currentCell.sheet().isEmpty() || currentCell.isOnSheet(table.anchorSheet())
                ? ""
                : SheetNames.calcQualifier(table.anchorSheet());
        String start = addressingMode.render(firstColumn, rows[0]);
        if (firstColumn == lastColumn && rows[0] == rows[1]) {
            return Token.of(TokenKind.CELL_REFERENCE, prefix + start);
        }
        return Token.of(TokenKind.RANGE_REFERENCE, prefix + start + ":" + addressingMode.render(lastColumn, rows[1]));
    }

    private int[] rowSpan(String text, Set<ItemSpecifier> items, TableGeometry table, CellAddress currentCell) {
        if (items.contains(ItemSpecifier.THIS_ROW)) {
            if (items.size() > 1) {
                throw new ResolveException(ResolveException.Kind.MALFORMED_REFERENCE, text,
                        "#This Row cannot be combined with other item specifiers");
            }
            boolean sameSheet = currentCell.sheet().isEmpty() || currentCell.isOnSheet(table.anchorSheet());
            if (!sameSheet || !table.containsDataRow(currentCell.row())) {
                throw new ResolveException(ResolveException.Kind.NO_ENCLOSING_TABLE, text,
                        "cell " + currentCell + " is outside the data rows of " + table.tableName());
            }
            return new int[] {currentCell.row(), currentCell.row()};
        }
        if (items.contains(ItemSpecifier.TOTALS)) {
            throw new ResolveException(ResolveException.Kind.MALFORMED_REFERENCE, text,
                    "table " + table.tableName() + " has no totals row");
        }
        if (items.contains(ItemSpecifier.ALL)
                || (items.contains(ItemSpecifier.HEADERS) && items.contains(ItemSpecifier.DATA))) {
            return new int[] {table.headerRow(), table.lastDataRow()};
        }
        if (items.contains(ItemSpecifier.HEADERS)) {
            return new int[] {table.headerRow(), table.headerRow()};
        }
        return new int[] {table.firstDataRow(), table.lastDataRow()};
    }

    private static TableGeometry findTable(String text, String name, Collection<TableGeometry> tables) {
        return tables.stream()
                .filter(table -> table.tableName().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new ResolveException(ResolveException.Kind.UNKNOWN_TABLE, text,
                        "no geometry for table " + name));
    }

    private static TableGeometry enclosingTable(String text, Collection<TableGeometry> tables, CellAddress currentCell) {
        return tables.stream()
                .filter(table -> currentCell.sheet().isEmpty()
                        ? table.containsDataRow(currentCell.row())
                        && currentCell.column() >= table.anchorColumn()
                        && currentCell.column() <= table.lastColumn()
                        : table.containsDataCell(currentCell))
                .findFirst()
                .orElseThrow(() -> new ResolveException(ResolveException.Kind.NO_ENCLOSING_TABLE, text,
                        "cell " + currentCell + " is not inside any table"));
    }

    private static int columnIndex(String text, TableGeometry table, String columnName) {
        return table.columnIndex(columnName)
                .orElseThrow(() -> new ResolveException(ResolveException.Kind.UNKNOWN_COLUMN, text,
                        "table " + table.tableName() + " has no column " + columnName));
    }
}
