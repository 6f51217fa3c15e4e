package com.wbsledger.reports.report;

import com.wbsledger.reports.config.ReportsProperties;
import com.wbsledger.reports.ingest.CleaningProfile;
import com.wbsledger.reports.model.ColumnKey;
import java.nio.charset.Charset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Report types known to the service, built once from {@code reports.report-types}.
 */
@Component
public class ReportTypeRegistry {

    private final Map<String, ReportDefinition> definitions;

    public ReportTypeRegistry(ReportsProperties properties) {
        Map<String, ReportDefinition> built = new TreeMap<>();
        properties.reportTypes().forEach((type, config) -> built.put(type, toDefinition(type, config)));
        this.definitions = Map.copyOf(built);
    }

    public ReportDefinition require(String reportType) {
        ReportDefinition definition = reportType == null ? null : definitions.get(reportType);
        if (definition == null) {
            throw new UnknownReportTypeException(reportType);
        }
        return definition;
    }

    public Set<String> reportTypes() {
        return new TreeSet<>(definitions.keySet());
    }

    static ReportDefinition toDefinition(String type, ReportsProperties.ReportType config) {
        CleaningProfile profile = new CleaningProfile(
                config.format(),
                Charset.forName(config.encoding()),
                config.delimiterChar(),
                new HashSet<>(config.discardLines()),
                config.headerRows(),
                config.fillGroupLabelsFlag(),
                config.dropTrailingRows()
        );
        ColumnSelection columns = new ColumnSelection(
                config.codeColumn() == null || config.codeColumn().isBlank() ? null : ColumnKey.parse(config.codeColumn()),
                config.codeColumnIndex(),
                config.codeExtraction(),
                keys(config.numericColumns()),
                config.numericFromColumn(),
                keys(config.textColumns())
        );
        return new ReportDefinition(type, profile, columns);
    }

    private static List<ColumnKey> keys(List<String> notations) {
        return notations.stream().map(ColumnKey::parse).toList();
    }
}
