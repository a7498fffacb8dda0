package org.cpoanalyzer.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class DelimitedTableTest {

    private static final Path SOURCE = Paths.get("shard-00001.0000.dat");

    private static DelimitedTable table(String content) throws Exception {
        return DelimitedTable.read(SOURCE, new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void read_splitsOnAnyWhitespaceAndSkipsBlankLines() throws Exception {
        DelimitedTable table = table("\n  id   x\ty\n\n1  2.5   -3e2\n");

        assertThat(table.rows()).hasSize(1);
        DelimitedTable.Row row = table.rows().get(0);
        assertThat(row.lineNumber()).isEqualTo(4);
        assertThat(table.getLong(row, "id")).isEqualTo(1L);
        assertThat(table.getDouble(row, "x")).isEqualTo(2.5);
        assertThat(table.getDouble(row, "y")).isEqualTo(-300.0);
    }

    @Test
    void getLong_acceptsIntegralFloatingPointIds() throws Exception {
        DelimitedTable table = table("id\n12.0\n12.5\n");

        assertThat(table.getLong(table.rows().get(0), "id")).isEqualTo(12L);
        assertThatThrownBy(() -> table.getLong(table.rows().get(1), "id"))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("not an integer");
    }

    @Test
    void getOptionalDouble_isEmptyOnlyForAbsentColumns() throws Exception {
        DelimitedTable table = table("id z\n1 4.0\n");
        DelimitedTable.Row row = table.rows().get(0);

        assertThat(table.getOptionalDouble(row, "z")).hasValue(4.0);
        assertThat(table.getOptionalDouble(row, "olivine_deformation_type")).isEmpty();
    }

    @Test
    void shortRow_isMalformed() throws Exception {
        DelimitedTable table = table("id x y\n1 2\n");

        assertThatThrownBy(() -> table.getDouble(table.rows().get(0), "y"))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("2 fields");
    }

    @Test
    void missingColumn_isMalformedAndNamesFile() throws Exception {
        DelimitedTable table = table("id\n1\n");

        assertThatThrownBy(() -> table.getDouble(table.rows().get(0), "x"))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageStartingWith(SOURCE.toString())
                .hasMessageContaining("missing column 'x'");
    }

    @Test
    void emptyStream_hasNoColumnsAndNoRows() throws Exception {
        DelimitedTable table = table("");

        assertThat(table.rows()).isEmpty();
        assertThat(table.hasColumn("id")).isFalse();
        assertThat(table.isEmpty()).isTrue();
    }

    @Test
    void headerOnly_isNotEmpty() throws Exception {
        assertThat(table("id x\n").isEmpty()).isFalse();
    }

    @Test
    void rowsWithSameContent_areDistinct() throws Exception {
        DelimitedTable table = table("id x\n1 2.0\n1 2.0\n");
        DelimitedTable.Row first = table.rows().get(0);
        DelimitedTable.Row second = table.rows().get(1);

        assertThat(first.fieldCount()).isEqualTo(2);
        assertThat(first).isNotEqualTo(second);
        assertThat(first).isEqualTo(table.rows().get(0));
        assertThat(first.lineNumber()).isEqualTo(2);
        assertThat(second.lineNumber()).isEqualTo(3);
    }
}
