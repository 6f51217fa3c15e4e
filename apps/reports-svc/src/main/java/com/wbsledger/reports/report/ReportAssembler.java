package com.wbsledger.reports.report;

import com.wbsledger.reports.catalog.CatalogDiagnostic;
import com.wbsledger.reports.catalog.CatalogMapper;
import com.wbsledger.reports.catalog.CatalogMapping;
import com.wbsledger.reports.catalog.CatalogSession;
import com.wbsledger.reports.catalog.CatalogSnapshot;
import com.wbsledger.reports.catalog.UnavailableReason;
import com.wbsledger.reports.format.IndianCurrencyFormatter;
import com.wbsledger.reports.hierarchy.CodeClassifier;
import com.wbsledger.reports.hierarchy.HierarchicalCodes;
import com.wbsledger.reports.ingest.ExportReaderService;
import com.wbsledger.reports.model.ClassificationResult;
import com.wbsledger.reports.model.ColumnDefinition;
import com.wbsledger.reports.model.ColumnRole;
import com.wbsledger.reports.model.ExportTable;
import com.wbsledger.reports.model.FormattedAmount;
import com.wbsledger.reports.model.OutputCell;
import com.wbsledger.reports.model.OutputRow;
import com.wbsledger.reports.model.RawRow;
import com.wbsledger.reports.model.ReportDiagnostics;
import com.wbsledger.reports.model.ReportResult;
import com.wbsledger.reports.model.RowKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one export through reading, classification, catalog mapping and amount
 * formatting. Classification and descriptions are computed once per distinct code,
 * so rows sharing a code always agree. Holds no per-request state.
 */
@Service
public class ReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

    private final ReportTypeRegistry registry;
    private final ExportReaderService readerService;
    private final CodeClassifier classifier;
    private final CatalogSession catalogSession;
    private final CatalogMapper catalogMapper;
    private final IndianCurrencyFormatter formatter;

    public ReportAssembler(
            ReportTypeRegistry registry,
            ExportReaderService readerService,
            CodeClassifier classifier,
            CatalogSession catalogSession,
            CatalogMapper catalogMapper,
            IndianCurrencyFormatter formatter
    ) {
        this.registry = registry;
        this.readerService = readerService;
        this.classifier = classifier;
        this.catalogSession = catalogSession;
        this.catalogMapper = catalogMapper;
        this.formatter = formatter;
    }

    public ReportResult assemble(String reportType, byte[] content) {
        return assemble(registry.require(reportType), content);
    }

    /**
     * @throws com.wbsledger.reports.ingest.ExportParseException when the export cannot be read
     */
    public ReportResult assemble(ReportDefinition definition, byte[] content) {
        ExportTable table = readerService.read(content, definition.cleaningProfile());
        List<ColumnDefinition> columns = definition.columns().bind(table);
        int codeIndex = codeIndex(columns);

        List<String> rowCodes = new ArrayList<>(table.rows().size());
        for (RawRow row : table.rows()) {
            String code = HierarchicalCodes.normalize(definition.columns().extractCode(row.value(codeIndex))).orElse("");
            rowCodes.add(code);
        }

        ClassificationResult classification = classifier.classify(rowCodes);
        List<String> distinctCodes = new ArrayList<>(classification.size());
        distinctCodes.addAll(classification.summary());
        distinctCodes.addAll(classification.leaf());

        CatalogSnapshot snapshot = catalogSession.snapshot();
        CatalogMapping mapping = catalogMapper.map(distinctCodes, snapshot);
        Set<String> summaryCodes = new HashSet<>(classification.summary());

        List<OutputRow> output = new ArrayList<>(table.rows().size());
        int fallbacks = 0;
        for (int r = 0; r < table.rows().size(); r++) {
            RawRow row = table.rows().get(r);
            String code = rowCodes.get(r);
            List<OutputCell> cells = new ArrayList<>(columns.size());
            for (ColumnDefinition column : columns) {
                String raw = row.value(column.index());
                FormattedAmount amount = null;
                if (column.role() == ColumnRole.NUMERIC) {
                    amount = formatter.formatCell(raw);
                    if (amount.fallback()) {
                        fallbacks++;
                        log.debug("Non-numeric value '{}' in {} at line {}", raw, column.key().label(), row.sourceLine());
                    }
                }
                cells.add(new OutputCell(column, raw, amount));
            }
            RowKind kind = summaryCodes.contains(code) ? RowKind.SUMMARY : RowKind.LEAF;
            output.add(new OutputRow(r + 1, row.sourceLine(), code, kind, mapping.describe(code), cells));
        }

        ReportDiagnostics diagnostics = new ReportDiagnostics(
                mapping.summary().totalCount(),
                mapping.summary().mappedCount(),
                mapping.summary().unmappedCount(),
                snapshot.statusLabel(),
                mapping.diagnostic().map(CatalogDiagnostic::reason).map(UnavailableReason::code).orElse(null),
                classification.summary().size(),
                classification.leaf().size(),
                table.encodingAnomalies(),
                fallbacks,
                table.skippedRows()
        );
        if (fallbacks > 0) {
            log.warn("{} non-numeric amount cell(s) shown as '{}'", fallbacks, formatter.fallback());
        }
        log.info("Report assembled: type={} rows={} codes={} summary={} leaf={} mapped={} unmapped={} catalog={}",
                definition.reportType(), output.size(), diagnostics.totalCodes(), diagnostics.summaryCount(),
                diagnostics.leafCount(), diagnostics.mappedCount(), diagnostics.unmappedCount(), diagnostics.catalogStatus());
        return new ReportResult(definition.reportType(), columns, output, classification, diagnostics);
    }

    private static int codeIndex(List<ColumnDefinition> columns) {
        for (ColumnDefinition column : columns) {
            if (column.role() == ColumnRole.CODE) {
                return column.index();
            }
        }
        throw new IllegalStateException("column binding produced no code column");
    }
}
