package com.wbsledger.reports.ingest;

import com.wbsledger.reports.model.ExportTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the first table of a hypertext export. Line discarding applies to the raw
 * markup before parsing; row numbers reported afterwards are 1-based table rows.
 *
 * <p>A {@code colspan} repeats the cell across the spanned columns. A {@code rowspan}
 * repeats the cell into the spanned data rows but leaves spanned header rows blank,
 * so a label that spans the header block contributes a single key fragment.
 */
@Component
public class HtmlTableExportReader implements ExportReader {

    private static final Logger log = LoggerFactory.getLogger(HtmlTableExportReader.class);

    @Override
    public ExportFormat format() {
        return ExportFormat.HTML;
    }

    @Override
    public ExportTable read(byte[] content, CleaningProfile profile) {
        DecodedText decoded = ExportDecoder.decode(content, profile.encoding());
        List<String> lines = LineCleaner.splitLines(decoded.text());
        if (lines.isEmpty()) {
            throw new ExportParseException("EMPTY_FILE", "Export is empty");
        }
        StringBuilder markup = new StringBuilder();
        for (SourceLine line : LineCleaner.clean(lines, profile)) {
            markup.append(line.text()).append('\n');
        }

        Document document = Jsoup.parse(markup.toString());
        Element table = firstTableWithRows(document);
        if (table == null) {
            throw new ExportParseException("MISSING_HEADER", "Export contains no table rows");
        }
        List<SourceRow> rows = toGrid(table.select("tr"), profile.headerRowCount());
        ExportTable result = RowSetNormalizer.normalize(rows, profile, decoded.anomalies());
        if (decoded.anomalies() > 0) {
            log.warn("Export contained {} undecodable byte sequence(s) for charset {}", decoded.anomalies(), profile.encoding());
        }
        log.info("Read html export: {} rows, {} columns", result.rows().size(), result.columnCount());
        return result;
    }

    private static Element firstTableWithRows(Document document) {
        for (Element table : document.select("table")) {
            if (!table.select("tr").isEmpty()) {
                return table;
            }
        }
        return null;
    }

    private static List<SourceRow> toGrid(Elements tableRows, int headerRowCount) {
        List<SourceRow> rows = new ArrayList<>(tableRows.size());
        // column -> cell still spanning down from an earlier row
        Map<Integer, PendingSpan> pending = new HashMap<>();
        int rowNumber = 0;
        for (Element tr : tableRows) {
            rowNumber++;
            boolean headerRow = rowNumber <= headerRowCount;
            List<String> cells = new ArrayList<>();
            int column = 0;
            for (Element cell : tr.children()) {
                if (!"td".equals(cell.normalName()) && !"th".equals(cell.normalName())) {
                    continue;
                }
                column = fillPending(pending, cells, column, headerRow);
                String text = cell.text().trim();
                int colspan = span(cell, "colspan");
                int rowspan = span(cell, "rowspan");
                for (int i = 0; i < colspan; i++) {
                    cells.add(text);
                    if (rowspan > 1) {
                        pending.put(column, new PendingSpan(text, rowspan - 1));
                    }
                    column++;
                }
            }
            fillPending(pending, cells, column, headerRow);
            rows.add(new SourceRow(rowNumber, cells));
        }
        return rows;
    }

    private static int fillPending(Map<Integer, PendingSpan> pending, List<String> cells, int column, boolean headerRow) {
        while (true) {
            PendingSpan span = pending.get(column);
            if (span == null) {
                return column;
            }
            cells.add(headerRow ? "" : span.text());
            if (span.remaining() <= 1) {
                pending.remove(column);
            } else {
                pending.put(column, new PendingSpan(span.text(), span.remaining() - 1));
            }
            column++;
        }
    }

    private static int span(Element cell, String attribute) {
        String raw = cell.attr(attribute).trim();
        if (raw.isEmpty()) {
            return 1;
        }
        try {
            return Math.max(1, Math.min(Integer.parseInt(raw), 1000));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private record PendingSpan(String text, int remaining) {
    }
}
