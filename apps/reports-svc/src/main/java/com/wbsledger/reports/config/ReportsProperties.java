package com.wbsledger.reports.config;

import com.wbsledger.reports.format.SignPlacement;
import com.wbsledger.reports.ingest.ExportFormat;
import com.wbsledger.reports.report.CodeExtraction;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "reports")
public record ReportsProperties(
        Catalog catalog,
        Currency currency,
        Map<String, ReportType> reportTypes
) {

    @ConstructorBinding
    public ReportsProperties {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog configuration must be provided");
        }
        // currency falls back to rupee defaults
        if (currency == null) {
            currency = new Currency(null, null, null);
        }
        if (reportTypes == null || reportTypes.isEmpty()) {
            throw new IllegalArgumentException("at least one report type must be configured");
        }
        reportTypes = Map.copyOf(reportTypes);
    }

    public record Catalog(
            String masterFile,
            String codeHeader,
            String nameHeader,
            String delimiter,
            String encoding,
            String store
    ) {
        public Catalog {
            if (masterFile == null || masterFile.isBlank()) {
                throw new IllegalArgumentException("masterFile must be provided");
            }
            if (codeHeader == null || codeHeader.isBlank()) {
                codeHeader = "WBS_element";
            }
            if (nameHeader == null || nameHeader.isBlank()) {
                nameHeader = "Name";
            }
            if (delimiter == null || delimiter.isEmpty()) {
                delimiter = ",";
            }
            if (encoding == null || encoding.isBlank()) {
                encoding = "UTF-8";
            }
            if (store == null || store.isBlank()) {
                store = "jdbc";
            }
        }

        public char delimiterChar() {
            return ReportsProperties.delimiterChar(delimiter);
        }
    }

    public record Currency(String symbol, SignPlacement signPlacement, String fallback) {
        public Currency {
            if (symbol == null) {
                symbol = "₹";
            }
            if (signPlacement == null) {
                signPlacement = SignPlacement.BEFORE_SYMBOL;
            }
            // fallback may stay null: the formatter then uses its zero-amount form
        }
    }

    public record ReportType(
            ExportFormat format,
            String encoding,
            String delimiter,
            List<Integer> discardLines,
            Integer headerRows,
            Boolean fillGroupLabels,
            Integer dropTrailingRows,
            String codeColumn,
            Integer codeColumnIndex,
            CodeExtraction codeExtraction,
            List<String> numericColumns,
            Integer numericFromColumn,
            List<String> textColumns
    ) {
        public ReportType {
            if (format == null) {
                format = ExportFormat.DELIMITED;
            }
            if (encoding == null || encoding.isBlank()) {
                encoding = format == ExportFormat.HTML ? "UTF-8" : "ISO-8859-1";
            }
            if (delimiter == null || delimiter.isEmpty()) {
                delimiter = "\t";
            }
            discardLines = discardLines == null ? List.of() : List.copyOf(discardLines);
            if (headerRows == null) {
                headerRows = 2;
            }
            if (headerRows < 1) {
                throw new IllegalArgumentException("headerRows must be positive");
            }
            if (dropTrailingRows == null) {
                dropTrailingRows = 0;
            }
            if ((codeColumn == null || codeColumn.isBlank()) && codeColumnIndex == null) {
                throw new IllegalArgumentException("codeColumn or codeColumnIndex must be provided");
            }
            if (codeColumnIndex != null && codeColumnIndex < 0) {
                throw new IllegalArgumentException("codeColumnIndex must not be negative");
            }
            if (numericFromColumn != null && numericFromColumn < 0) {
                throw new IllegalArgumentException("numericFromColumn must not be negative");
            }
            if (codeExtraction == null) {
                codeExtraction = CodeExtraction.WHOLE_VALUE;
            }
            numericColumns = numericColumns == null ? List.of() : List.copyOf(numericColumns);
            textColumns = textColumns == null ? List.of() : List.copyOf(textColumns);
        }

        public boolean fillGroupLabelsFlag() {
            return fillGroupLabels != null && fillGroupLabels;
        }

        public char delimiterChar() {
            return ReportsProperties.delimiterChar(delimiter);
        }
    }

    static char delimiterChar(String delimiter) {
        if ("\\t".equals(delimiter) || "tab".equalsIgnoreCase(delimiter)) {
            return '\t';
        }
        if (delimiter.length() != 1) {
            throw new IllegalArgumentException("delimiter must be a single character: '" + delimiter + "'");
        }
        return delimiter.charAt(0);
    }
}
