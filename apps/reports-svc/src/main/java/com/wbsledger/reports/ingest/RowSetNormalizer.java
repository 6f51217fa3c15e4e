package com.wbsledger.reports.ingest;

import com.wbsledger.reports.model.ColumnKey;
import com.wbsledger.reports.model.ExportTable;
import com.wbsledger.reports.model.RawRow;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns header rows plus data rows into a rectangular {@link ExportTable}.
 *
 * <p>Rows shorter than the header are padded and trailing blank cells are ignored.
 * A row that still carries cells beyond the header cannot be reconciled; such rows
 * are skipped while they are a minority, and fail the whole export once they are
 * the majority.
 */
final class RowSetNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RowSetNormalizer.class);

    private RowSetNormalizer() {
    }

    static ExportTable normalize(List<SourceRow> rows, CleaningProfile profile, int encodingAnomalies) {
        int headerCount = profile.headerRowCount();
        if (rows.size() < headerCount) {
            throw new ExportParseException("MISSING_HEADER",
                    "Export has " + rows.size() + " line(s) after cleaning, " + headerCount + " header row(s) expected");
        }
        List<List<String>> headerRows = new ArrayList<>(headerCount);
        for (int i = 0; i < headerCount; i++) {
            headerRows.add(rows.get(i).cells());
        }
        List<ColumnKey> header = HeaderCombiner.combine(headerRows, profile.fillGroupLabels());
        if (header.isEmpty()) {
            throw new ExportParseException("MISSING_HEADER", "Header rows carry no column labels",
                    rows.get(0).lineNumber(), 0);
        }
        int width = header.size();

        List<SourceRow> dataRows = new ArrayList<>();
        for (SourceRow row : rows.subList(headerCount, rows.size())) {
            if (row.effectiveWidth() > 0) {
                dataRows.add(row);
            }
        }
        int trailing = Math.min(profile.dropTrailingRows(), dataRows.size());
        dataRows = dataRows.subList(0, dataRows.size() - trailing);

        List<RawRow> accepted = new ArrayList<>(dataRows.size());
        List<SourceRow> rejected = new ArrayList<>();
        for (SourceRow row : dataRows) {
            if (row.effectiveWidth() > width) {
                rejected.add(row);
                continue;
            }
            List<String> values = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                values.add(i < row.cells().size() ? row.cells().get(i).trim() : "");
            }
            accepted.add(new RawRow(row.lineNumber(), values));
        }

        if (!rejected.isEmpty()) {
            SourceRow first = rejected.get(0);
            if (rejected.size() * 2 > dataRows.size()) {
                throw new ExportParseException("INCONSISTENT_COLUMNS",
                        rejected.size() + " of " + dataRows.size() + " data rows exceed the " + width
                                + " header columns (first at line " + first.lineNumber() + " with "
                                + first.effectiveWidth() + " cells)",
                        first.lineNumber(), first.effectiveWidth());
            }
            log.warn("Skipping {} of {} data rows wider than the {} header columns (first at line {})",
                    rejected.size(), dataRows.size(), width, first.lineNumber());
        }
        return new ExportTable(header, accepted, encodingAnomalies, rejected.size());
    }
}
