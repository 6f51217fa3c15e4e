package com.wbsledger.reports.report;

import com.wbsledger.reports.catalog.CatalogImportException;
import com.wbsledger.reports.ingest.ExportParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Turns a failure of a report run or catalog import into a structured {@link ReportError}.
 */
@Component
public class ReportErrorTranslator {

    public ReportError translate(Throwable ex) {
        if (ex instanceof ExportParseException parse) {
            Map<String, Object> details = new LinkedHashMap<>();
            if (parse.line() > 0) {
                details.put("line", parse.line());
            }
            if (parse.columns() >= 0) {
                details.put("columns", parse.columns());
            }
            return new ReportError(parse.errorCode(), parse.getMessage(), details);
        }
        if (ex instanceof UnknownReportTypeException) {
            return new ReportError("UNKNOWN_REPORT_TYPE", ex.getMessage(), Map.of());
        }
        if (ex instanceof CatalogImportException importFailure) {
            return new ReportError(importFailure.errorCode(), importFailure.getMessage(), Map.of());
        }
        if (ex instanceof DataAccessException dataAccess) {
            Throwable cause = dataAccess.getMostSpecificCause();
            return new ReportError("CATALOG_STORE_UNAVAILABLE", "Catalog store temporarily unavailable",
                    Map.of("reason", String.valueOf(cause.getMessage())));
        }
        if (ex instanceof IllegalArgumentException) {
            return new ReportError("INVALID_ARGUMENT", ex.getMessage(), Map.of());
        }
        return new ReportError("INTERNAL_ERROR", "Unexpected error", Map.of("reason", String.valueOf(ex.getMessage())));
    }
}
