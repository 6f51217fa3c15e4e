package com.wbsledger.reports.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.stream.Collectors;

/**
 * Creates the {@code wbs_elements} catalog table when it does not exist yet.
 * Statements in {@code db/catalog-schema.sql} are idempotent, so running it on every start is safe.
 * Disable with {@code reports.catalog.bootstrap-enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "reports.catalog", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class CatalogSchemaBootstrap {
    private static final Logger log = LoggerFactory.getLogger(CatalogSchemaBootstrap.class);
    static final String SCHEMA_RESOURCE = "db/catalog-schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public CatalogSchemaBootstrap(DataSource dataSource,
                                  @Value("${reports.catalog.bootstrap-enabled:true}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("Catalog schema bootstrap disabled (reports.catalog.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            int applied = 0;
            for (String stmt : loadSchemaSql().split(";")) {
                String trimmed = stmt.trim();
                if (trimmed.isEmpty()) continue;
                try (Statement s = conn.createStatement()) {
                    s.execute(trimmed);
                    applied++;
                }
            }
            log.info("Catalog schema bootstrap completed: {} statements applied", applied);
        } catch (SQLException | IOException e) {
            // Reports still run without the table; the catalog session then reports not-imported
            log.error("Catalog schema bootstrap failed (application will continue to start)", e);
        }
    }

    private String loadSchemaSql() throws IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines().collect(Collectors.joining("\n"));
        }
    }
}
