package com.wbsledger.reports.config;

import jakarta.annotation.PostConstruct;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final ReportsProperties props;

    public StartupDiagnostics(ReportsProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var catalog = props.catalog();
        log.info("Catalog config: masterFile='{}', store='{}', codeHeader='{}', nameHeader='{}', encoding='{}'",
                catalog.masterFile(), catalog.store(), catalog.codeHeader(), catalog.nameHeader(), catalog.encoding());

        var currency = props.currency();
        log.info("Currency config: symbol='{}', signPlacement={}, fallbackConfigured={}",
                currency.symbol(), currency.signPlacement(), currency.fallback() != null);

        log.info("Report types: {}", new TreeSet<>(props.reportTypes().keySet()));
        props.reportTypes().forEach((name, type) -> log.debug(
                "Report type '{}': format={}, encoding={}, discardLines={}, headerRows={}, dropTrailingRows={}",
                name, type.format(), type.encoding(), type.discardLines(), type.headerRows(), type.dropTrailingRows()));
    }
}
