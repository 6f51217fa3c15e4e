package com.wbsledger.reports.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.wbsledger.reports.model.ColumnKey;
import com.wbsledger.reports.model.ExportTable;
import com.wbsledger.reports.model.RawRow;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DelimitedExportReaderTest {

    private final DelimitedExportReader reader = new DelimitedExportReader();

    private static final CleaningProfile BUDGET_REPORT = new CleaningProfile(
            ExportFormat.DELIMITED, StandardCharsets.ISO_8859_1, '\t', Set.of(0, 1, 4, -1), 2, false, 0);

    private static final CleaningProfile SINGLE_HEADER = new CleaningProfile(
            ExportFormat.DELIMITED, StandardCharsets.UTF_8, '\t', Set.of(), 1, false, 0);

    private static byte[] fixture(String name) throws IOException {
        try (InputStream in = DelimitedExportReaderTest.class.getResourceAsStream("/exports/" + name)) {
            return in.readAllBytes();
        }
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void readsBudgetReportExport() throws IOException {
        ExportTable table = reader.read(fixture("budget-report.dat"), BUDGET_REPORT);

        assertThat(table.header()).containsExactly(
                ColumnKey.of("Object"),
                ColumnKey.of("Original", "Budget"),
                ColumnKey.of("Current", "Budget"),
                ColumnKey.of("Actual", "Cost"));
        assertThat(table.rows()).hasSize(5);
        RawRow first = table.rows().get(0);
        assertThat(first.sourceLine()).isEqualTo(6);
        assertThat(first.values()).containsExactly("* Civil works NL-C-001", "1,50,000.00", "150000", "5000-");
        assertThat(table.rows().get(3).values()).containsExactly("*** Footing NL-C-001-01-01", "100", "100", "");
        assertThat(table.encodingAnomalies()).isZero();
        assertThat(table.skippedRows()).isZero();
    }

    @Test
    void padsShortRowsAndDropsBlankRows() {
        ExportTable table = reader.read(utf8("Code\tPlan\tActual\nA-01\t5\n\t\t\n\nA\t1\t2\t\t\n"), SINGLE_HEADER);

        assertThat(table.rows()).extracting(RawRow::values).containsExactly(
                List.of("A-01", "5", ""),
                List.of("A", "1", "2"));
        assertThat(table.rows()).extracting(RawRow::sourceLine).containsExactly(2, 5);
    }

    @Test
    void tabExportKeepsStrayQuotes() {
        ExportTable table = reader.read(utf8("Code\tName\nA\t12\" pipe\n"), SINGLE_HEADER);

        assertThat(table.rows().get(0).value(1)).isEqualTo("12\" pipe");
    }

    @Test
    void commaExportKeepsReadingPastUnbalancedQuote() {
        CleaningProfile comma = new CleaningProfile(ExportFormat.DELIMITED, StandardCharsets.UTF_8, ',', Set.of(), 1, false, 0);
        byte[] content = utf8("Code,Plan\nA,1\nB,2\n\"C,4\nD,\"5\"\nE,6\n");

        ExportTable table = reader.read(content, comma);

        assertThat(table.rows()).extracting(row -> row.value(0)).containsExactly("A", "B", "\"C", "D", "E");
        assertThat(table.rows().get(2).value(1)).isEqualTo("4");
        assertThat(table.rows().get(3).value(1)).isEqualTo("5");
        assertThat(table.skippedRows()).isZero();
    }

    @Test
    void unbalancedQuoteRowWiderThanHeaderIsSkipped() {
        CleaningProfile comma = new CleaningProfile(ExportFormat.DELIMITED, StandardCharsets.UTF_8, ',', Set.of(), 1, false, 0);
        byte[] content = utf8("Code,Plan\nA,1\nB,2\n\"C,\"x,4\nD,5\n");

        ExportTable table = reader.read(content, comma);

        assertThat(table.rows()).extracting(row -> row.value(0)).containsExactly("A", "B", "D");
        assertThat(table.skippedRows()).isEqualTo(1);
    }

    @Test
    void plainSplitKeepsEmptyTrailingCells() {
        assertThat(DelimitedExportReader.plainSplit("\"a,b,", ",")).containsExactly("\"a", "b", "");
    }

    @Test
    void headerOnlyExportHasNoRows() {
        ExportTable table = reader.read(utf8("Code\tPlan\n"), SINGLE_HEADER);

        assertThat(table.columnCount()).isEqualTo(2);
        assertThat(table.rows()).isEmpty();
    }

    @Test
    void emptyExportIsRejected() {
        assertThatThrownBy(() -> reader.read(new byte[0], SINGLE_HEADER))
                .isInstanceOf(ExportParseException.class)
                .satisfies(e -> assertThat(((ExportParseException) e).errorCode()).isEqualTo("EMPTY_FILE"));
    }

    @Test
    void tooFewLinesForHeaderIsRejected() {
        byte[] content = utf8("title\ndate\nonly header\n");

        assertThatThrownBy(() -> reader.read(content, BUDGET_REPORT))
                .isInstanceOf(ExportParseException.class)
                .satisfies(e -> assertThat(((ExportParseException) e).errorCode()).isEqualTo("MISSING_HEADER"));
    }

    @Test
    void minorityOfWideRowsIsSkipped() {
        ExportTable table = reader.read(utf8("Code\tPlan\nA\t1\nB\t2\nC\t3\t99\n"), SINGLE_HEADER);

        assertThat(table.rows()).extracting(row -> row.value(0)).containsExactly("A", "B");
        assertThat(table.skippedRows()).isEqualTo(1);
    }

    @Test
    void majorityOfWideRowsFailsWithLineAndColumnCount() {
        byte[] content = utf8("Code\tPlan\nA\t1\t2\nB\t2\t3\nC\t3\n");

        assertThatThrownBy(() -> reader.read(content, SINGLE_HEADER))
                .isInstanceOfSatisfying(ExportParseException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo("INCONSISTENT_COLUMNS");
                    assertThat(e.line()).isEqualTo(2);
                    assertThat(e.columns()).isEqualTo(3);
                });
    }

    @Test
    void countsUndecodableBytes() {
        byte[] content = {'C', 'o', 'd', 'e', '\n', 'A', (byte) 0xFF, '\n'};

        ExportTable table = reader.read(content, SINGLE_HEADER);

        assertThat(table.encodingAnomalies()).isEqualTo(1);
        assertThat(table.rows().get(0).value(0)).isEqualTo("A\uFFFD");
    }
}
