package ai.formula.translator.formula;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CellAddressTest {

    @Test
    void parsesPlainAndQualifiedAddresses() {
        CellAddress plain = CellAddress.parse("B5");
        CellAddress quoted = CellAddress.parse("'My Sheet'!$AB$12");

        assertThat(plain.sheet()).isEmpty();
        assertThat(plain.column()).isEqualTo(2);
        assertThat(plain.row()).isEqualTo(5);
        assertThat(quoted.sheet()).contains("My Sheet");
        assertThat(quoted.column()).isEqualTo(28);
        assertThat(quoted.toString()).isEqualTo("'My Sheet'!AB12");
        assertThat(CellAddress.parse("Data!C3").toString()).isEqualTo("Data!C3");
    }

    @Test
    void convertsColumnLettersBothWays() {
        assertThat(CellAddress.columnNumber("A")).isEqualTo(1);
        assertThat(CellAddress.columnNumber("az")).isEqualTo(52);
        assertThat(CellAddress.columnName(27)).isEqualTo("AA");
        assertThat(CellAddress.columnName(16_384)).isEqualTo("XFD");
    }

    @Test
    void rejectsInvalidAddresses() {
        assertThatThrownBy(() -> CellAddress.parse("5B")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CellAddress.parse("A0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CellAddress.parse("XFE1")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void quotesSheetNamesOnlyWhenNeeded() {
        assertThat(SheetNames.quoteIfNeeded("Sheet1")).isEqualTo("Sheet1");
        assertThat(SheetNames.quoteIfNeeded("Q1 Data")).isEqualTo("'Q1 Data'");
        assertThat(SheetNames.quoteIfNeeded("O'Brien")).isEqualTo("'O''Brien'");
        assertThat(SheetNames.needsQuotes("AB1")).isTrue();
        assertThat(SheetNames.qualifier("Übersicht")).isEqualTo("Übersicht!");
    }
}
