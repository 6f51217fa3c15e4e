package com.wbsledger.reports.catalog;

import com.wbsledger.reports.config.ReportsProperties;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * The delimited master file the catalog is imported from: a header row naming a
 * code column and a name column, one catalog entry per following row.
 */
@Component
public class CatalogMasterFile {

    private final Path path;
    private final String codeHeader;
    private final String nameHeader;
    private final char delimiter;
    private final Charset encoding;

    @Autowired
    public CatalogMasterFile(ReportsProperties properties) {
        this(Path.of(properties.catalog().masterFile()),
                properties.catalog().codeHeader(),
                properties.catalog().nameHeader(),
                properties.catalog().delimiterChar(),
                Charset.forName(properties.catalog().encoding()));
    }

    public CatalogMasterFile(Path path, String codeHeader, String nameHeader, char delimiter, Charset encoding) {
        this.path = path;
        this.codeHeader = codeHeader;
        this.nameHeader = nameHeader;
        this.delimiter = delimiter;
        this.encoding = encoding;
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    public OptionalLong sizeBytes() {
        try {
            return exists() ? OptionalLong.of(Files.size(path)) : OptionalLong.empty();
        } catch (IOException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * Reads every row with a non-blank code and name, in file order.
     *
     * @throws CatalogImportException when the file is missing, unreadable or lacks the expected headers
     */
    public List<CatalogEntry> readEntries() {
        if (!exists()) {
            throw new CatalogImportException("FILE_NOT_FOUND", "Catalog master file not found: " + path);
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .build();
        try (Reader reader = Files.newBufferedReader(path, encoding);
             CSVParser parser = CSVParser.parse(reader, format)) {
            Map<String, Integer> headers = parser.getHeaderMap();
            if (!headers.containsKey(codeHeader) || !headers.containsKey(nameHeader)) {
                throw new CatalogImportException("MISSING_COLUMNS",
                        "Catalog master file must contain \"" + codeHeader + "\" and \"" + nameHeader + "\" columns");
            }
            List<CatalogEntry> entries = new ArrayList<>();
            for (CSVRecord record : parser) {
                String code = record.isSet(codeHeader) ? record.get(codeHeader).trim() : "";
                String name = record.isSet(nameHeader) ? record.get(nameHeader).trim() : "";
                if (!code.isEmpty() && !name.isEmpty()) {
                    entries.add(new CatalogEntry(code, name));
                }
            }
            return entries;
        } catch (IOException | UncheckedIOException e) {
            throw new CatalogImportException("UNREADABLE_FILE", "Catalog master file could not be read: " + e.getMessage(), e);
        }
    }
}
