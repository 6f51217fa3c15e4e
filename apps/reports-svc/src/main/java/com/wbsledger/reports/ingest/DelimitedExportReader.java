package com.wbsledger.reports.ingest;

import com.wbsledger.reports.model.ExportTable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads delimited text exports (tab separated DAT files and the like).
 */
@Component
public class DelimitedExportReader implements ExportReader {

    private static final Logger log = LoggerFactory.getLogger(DelimitedExportReader.class);

    @Override
    public ExportFormat format() {
        return ExportFormat.DELIMITED;
    }

    @Override
    public ExportTable read(byte[] content, CleaningProfile profile) {
        DecodedText decoded = ExportDecoder.decode(content, profile.encoding());
        List<String> lines = LineCleaner.splitLines(decoded.text());
        if (lines.isEmpty()) {
            throw new ExportParseException("EMPTY_FILE", "Export is empty");
        }
        List<SourceLine> kept = LineCleaner.clean(lines, profile);
        log.debug("Delimited export cleaned: {} -> {} lines", lines.size(), kept.size());

        CSVFormat format = csvFormat(profile.delimiter());
        List<SourceRow> rows = new ArrayList<>(kept.size());
        for (SourceLine line : kept) {
            rows.add(new SourceRow(line.lineNumber(), split(format, line)));
        }
        ExportTable table = RowSetNormalizer.normalize(rows, profile, decoded.anomalies());
        if (decoded.anomalies() > 0) {
            log.warn("Export contained {} undecodable byte sequence(s) for charset {}", decoded.anomalies(), profile.encoding());
        }
        log.info("Read delimited export: {} rows, {} columns", table.rows().size(), table.columnCount());
        return table;
    }

    static CSVFormat csvFormat(char delimiter) {
        CSVFormat.Builder builder = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(false);
        // tab exports are unquoted; a stray quote is part of the value
        if (delimiter == '\t') {
            builder.setQuote(null);
        }
        return builder.build();
    }

    private static List<String> split(CSVFormat format, SourceLine line) {
        if (line.text().isEmpty()) {
            return List.of();
        }
        try (CSVParser parser = CSVParser.parse(line.text(), format)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.isEmpty()) {
                return List.of();
            }
            List<String> cells = new ArrayList<>(records.get(0).size());
            records.get(0).forEach(cells::add);
            return cells;
        } catch (IOException | UncheckedIOException e) {
            // unbalanced quote; quotes stay part of the values
            log.warn("Line {} has unbalanced quotes, splitting on the bare delimiter: {}", line.lineNumber(), e.getMessage());
            return plainSplit(line.text(), format.getDelimiterString());
        }
    }

    static List<String> plainSplit(String text, String delimiter) {
        return Arrays.asList(text.split(Pattern.quote(delimiter), -1));
    }
}
