package com.wbsledger.reports.catalog;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Catalog kept in the {@code wbs_elements} table.
 */
@Repository
@ConditionalOnProperty(prefix = "reports.catalog", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcCatalogStore implements CatalogStore {

    private static final RowMapper<CatalogEntry> ROW_MAPPER =
            (rs, rowNum) -> new CatalogEntry(rs.getString("wbs_element"), rs.getString("name"));

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcCatalogStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<CatalogEntry> findAll() {
        return jdbcTemplate.query("SELECT wbs_element, name FROM wbs_elements ORDER BY wbs_element",
                new MapSqlParameterSource(), ROW_MAPPER);
    }

    @Override
    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM wbs_elements",
                new MapSqlParameterSource(), Integer.class);
        return count != null ? count : 0;
    }

    @Override
    public List<CatalogEntry> sample(int limit) {
        return jdbcTemplate.query("SELECT wbs_element, name FROM wbs_elements ORDER BY wbs_element LIMIT :limit",
                new MapSqlParameterSource("limit", limit), ROW_MAPPER);
    }

    @Override
    @Transactional
    public void replaceAll(List<CatalogEntry> entries) {
        jdbcTemplate.update("DELETE FROM wbs_elements", new MapSqlParameterSource());
        if (entries.isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> params = new ArrayList<>(entries.size());
        for (CatalogEntry entry : entries) {
            params.add(new MapSqlParameterSource()
                    .addValue("code", entry.code())
                    .addValue("name", entry.description()));
        }
        jdbcTemplate.batchUpdate("INSERT INTO wbs_elements (wbs_element, name) VALUES (:code, :name)",
                params.toArray(MapSqlParameterSource[]::new));
    }
}
