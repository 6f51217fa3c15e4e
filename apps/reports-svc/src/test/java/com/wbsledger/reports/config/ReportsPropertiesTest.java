package com.wbsledger.reports.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.wbsledger.reports.format.SignPlacement;
import com.wbsledger.reports.ingest.ExportFormat;
import com.wbsledger.reports.report.CodeExtraction;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReportsPropertiesTest {

    private static ReportsProperties.ReportType minimalType() {
        return new ReportsProperties.ReportType(null, null, null, null, null, null, null, "Object", null, null, null, 1, null);
    }

    @Test
    void appliesDefaults() {
        ReportsProperties props = new ReportsProperties(
                new ReportsProperties.Catalog("data/wbs_master.csv", null, null, null, null, null),
                null,
                Map.of("budget-report", minimalType()));

        assertThat(props.catalog().codeHeader()).isEqualTo("WBS_element");
        assertThat(props.catalog().nameHeader()).isEqualTo("Name");
        assertThat(props.catalog().delimiterChar()).isEqualTo(',');
        assertThat(props.catalog().store()).isEqualTo("jdbc");
        assertThat(props.currency().symbol()).isEqualTo("₹");
        assertThat(props.currency().signPlacement()).isEqualTo(SignPlacement.BEFORE_SYMBOL);
        assertThat(props.currency().fallback()).isNull();

        ReportsProperties.ReportType type = props.reportTypes().get("budget-report");
        assertThat(type.format()).isEqualTo(ExportFormat.DELIMITED);
        assertThat(type.encoding()).isEqualTo("ISO-8859-1");
        assertThat(type.delimiterChar()).isEqualTo('\t');
        assertThat(type.headerRows()).isEqualTo(2);
        assertThat(type.discardLines()).isEmpty();
        assertThat(type.fillGroupLabelsFlag()).isFalse();
        assertThat(type.codeExtraction()).isEqualTo(CodeExtraction.WHOLE_VALUE);
    }

    @Test
    void htmlTypesDefaultToUtf8() {
        ReportsProperties.ReportType type = new ReportsProperties.ReportType(
                ExportFormat.HTML, null, null, List.of(0, 1), 2, true, 1, null, 0, null, null, 2, null);

        assertThat(type.encoding()).isEqualTo("UTF-8");
        assertThat(type.fillGroupLabelsFlag()).isTrue();
    }

    @Test
    void delimiterAcceptsTabAliases() {
        assertThat(ReportsProperties.delimiterChar("tab")).isEqualTo('\t');
        assertThat(ReportsProperties.delimiterChar("\\t")).isEqualTo('\t');
        assertThat(ReportsProperties.delimiterChar(";")).isEqualTo(';');
        assertThatThrownBy(() -> ReportsProperties.delimiterChar("||"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMissingMasterFile() {
        assertThatThrownBy(() -> new ReportsProperties.Catalog(" ", null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("masterFile");
    }

    @Test
    void rejectsReportTypeWithoutCodeColumn() {
        assertThatThrownBy(() -> new ReportsProperties.ReportType(null, null, null, null, null, null, null, null, null, null, null, 1, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("codeColumn");
    }

    @Test
    void rejectsNegativeColumnIndexes() {
        assertThatThrownBy(() -> new ReportsProperties.ReportType(null, null, null, null, null, null, null, "Object", null, null, null, -1, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numericFromColumn");
        assertThatThrownBy(() -> new ReportsProperties.ReportType(ExportFormat.HTML, null, null, null, 2, null, null, null, -1, null, null, 2, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("codeColumnIndex");
    }

    @Test
    void rejectsEmptyReportTypeTable() {
        ReportsProperties.Catalog catalog = new ReportsProperties.Catalog("data/wbs_master.csv", null, null, null, null, null);

        assertThatThrownBy(() -> new ReportsProperties(catalog, null, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReportsProperties(null, null, Map.of("t", minimalType())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
