package com.wbsledger.reports.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.wbsledger.reports.catalog.CatalogImportException;
import com.wbsledger.reports.ingest.ExportParseException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class ReportErrorTranslatorTest {

    private final ReportErrorTranslator translator = new ReportErrorTranslator();

    @Test
    void parseFailureCarriesLineAndColumns() {
        ReportError error = translator.translate(
                new ExportParseException("INCONSISTENT_COLUMNS", "too wide", 12, 7));

        assertThat(error.code()).isEqualTo("INCONSISTENT_COLUMNS");
        assertThat(error.message()).isEqualTo("too wide");
        assertThat(error.details()).containsEntry("line", 12).containsEntry("columns", 7);
    }

    @Test
    void parseFailureWithoutLocationHasNoDetails() {
        ReportError error = translator.translate(new ExportParseException("EMPTY_FILE", "Export is empty"));

        assertThat(error.details()).isEmpty();
    }

    @Test
    void unknownReportType() {
        ReportError error = translator.translate(new UnknownReportTypeException("year-end"));

        assertThat(error.code()).isEqualTo("UNKNOWN_REPORT_TYPE");
        assertThat(error.message()).contains("year-end");
    }

    @Test
    void catalogImportKeepsItsCode() {
        ReportError error = translator.translate(new CatalogImportException("MISSING_COLUMNS", "no Name column"));

        assertThat(error.code()).isEqualTo("MISSING_COLUMNS");
    }

    @Test
    void storeOutageAndUnexpectedFailures() {
        assertThat(translator.translate(new DataAccessResourceFailureException("down")).code())
                .isEqualTo("CATALOG_STORE_UNAVAILABLE");
        assertThat(translator.translate(new IllegalArgumentException("bad")).code()).isEqualTo("INVALID_ARGUMENT");
        assertThat(translator.translate(new IllegalStateException("boom")).code()).isEqualTo("INTERNAL_ERROR");
    }
}
