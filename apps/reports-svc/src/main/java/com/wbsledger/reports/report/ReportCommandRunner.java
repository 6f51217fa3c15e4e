package com.wbsledger.reports.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.wbsledger.reports.catalog.CatalogImportService;
import com.wbsledger.reports.catalog.CatalogStatusReporter;
import com.wbsledger.reports.model.ReportResult;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Command line entry points:
 * <ul>
 *   <li>{@code --report-type=<type> --input=<file> [--output=<json>]} assembles one report</li>
 *   <li>{@code --import-catalog} imports the catalog master file</li>
 *   <li>{@code --catalog-status} prints the catalog status check</li>
 * </ul>
 * Without any of these options nothing runs.
 */
@Component
public class ReportCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReportCommandRunner.class);

    private final ReportAssembler assembler;
    private final CatalogImportService importService;
    private final CatalogStatusReporter statusReporter;
    private final ReportErrorTranslator errorTranslator;
    private final ObjectMapper objectMapper;

    public ReportCommandRunner(
            ReportAssembler assembler,
            CatalogImportService importService,
            CatalogStatusReporter statusReporter,
            ReportErrorTranslator errorTranslator,
            ObjectMapper objectMapper
    ) {
        this.assembler = assembler;
        this.importService = importService;
        this.statusReporter = statusReporter;
        this.errorTranslator = errorTranslator;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("import-catalog")) {
            runCatalogImport();
        }
        if (args.containsOption("catalog-status")) {
            log.info("Catalog status: {}", statusReporter.status());
        }
        String reportType = single(args, "report-type");
        String input = single(args, "input");
        if (reportType != null || input != null) {
            if (reportType == null || input == null) {
                log.error("Both --report-type and --input are required to run a report");
                return;
            }
            runReport(reportType, Path.of(input), single(args, "output"));
        }
    }

    /**
     * Assembles one file; failures are logged as a structured error and do not stop the application.
     *
     * @return the result, or null when the file could not be processed
     */
    public ReportResult runReport(String reportType, Path input, String output) {
        try {
            ReportResult result = assembler.assemble(reportType, Files.readAllBytes(input));
            if (result.diagnostics().degraded()) {
                log.warn("Report {} produced in degraded mode: catalog {} for {} code(s)",
                        input.getFileName(), result.diagnostics().unavailableReason(), result.diagnostics().totalCodes());
            }
            if (output != null) {
                write(result, Path.of(output));
            }
            return result;
        } catch (IOException e) {
            log.error("Report input {} could not be read", input, e);
            return null;
        } catch (RuntimeException e) {
            ReportError error = errorTranslator.translate(e);
            log.error("Report {} failed: code={} message={} details={}", input, error.code(), error.message(), error.details());
            return null;
        }
    }

    private void runCatalogImport() {
        try {
            CatalogImportService.ImportOutcome outcome = importService.importMasterFile();
            log.info("Catalog import: {}", outcome);
        } catch (RuntimeException e) {
            ReportError error = errorTranslator.translate(e);
            log.error("Catalog import failed: code={} message={}", error.code(), error.message());
        }
    }

    private void write(ReportResult result, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(output)) {
            objectMapper.writeValue(out, result);
        }
        log.info("Report written to {}", output);
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
