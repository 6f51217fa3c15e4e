package com.wbsledger.reports;

import static org.assertj.core.api.Assertions.assertThat;

import com.wbsledger.reports.catalog.CatalogSession;
import com.wbsledger.reports.catalog.CatalogStore;
import com.wbsledger.reports.catalog.JdbcCatalogStore;
import com.wbsledger.reports.catalog.UnavailableReason;
import com.wbsledger.reports.model.OutputRow;
import com.wbsledger.reports.model.ReportResult;
import com.wbsledger.reports.model.RowKind;
import com.wbsledger.reports.report.ReportAssembler;
import com.wbsledger.reports.report.ReportTypeRegistry;
import java.io.IOException;
import java.io.InputStream;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ReportsServiceApplicationTest {

    @Autowired
    private ReportTypeRegistry registry;

    @Autowired
    private CatalogStore catalogStore;

    @Autowired
    private CatalogSession catalogSession;

    @Autowired
    private ReportAssembler assembler;

    @Test
    void contextLoadsConfiguredReportTypes() {
        assertThat(registry.reportTypes()).containsExactly("budget-report", "budget-variance");
        assertThat(catalogStore).isInstanceOf(JdbcCatalogStore.class);
        assertThat(catalogStore.count()).isZero();
    }

    @Test
    void processesExportWithoutImportedCatalog() throws IOException {
        byte[] content;
        try (InputStream in = getClass().getResourceAsStream("/exports/budget-variance.html")) {
            content = in.readAllBytes();
        }

        ReportResult result = assembler.assemble("budget-variance", content);

        assertThat(result.rows()).extracting(OutputRow::rowKind).containsExactly(RowKind.SUMMARY, RowKind.LEAF);
        assertThat(result.diagnostics().degraded()).isTrue();
        assertThat(catalogSession.snapshot().reason()).isEqualTo(UnavailableReason.SOURCE_MISSING);
    }
}
