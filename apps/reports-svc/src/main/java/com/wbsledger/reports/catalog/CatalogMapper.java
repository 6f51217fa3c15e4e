package com.wbsledger.reports.catalog;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Attaches catalog descriptions to codes. Never throws: an unavailable catalog yields
 * blank descriptions plus a {@link CatalogDiagnostic}.
 */
@Component
public class CatalogMapper {

    private static final Logger log = LoggerFactory.getLogger(CatalogMapper.class);

    public CatalogMapping map(Collection<String> codes, CatalogSnapshot snapshot) {
        Set<String> distinct = new LinkedHashSet<>();
        if (codes != null) {
            for (String code : codes) {
                if (code != null && !code.isBlank()) {
                    distinct.add(code);
                }
            }
        }
        Map<String, String> descriptions = new LinkedHashMap<>();

        if (snapshot == null || !snapshot.isAvailable()) {
            UnavailableReason reason = snapshot != null && snapshot.reason() != null
                    ? snapshot.reason()
                    : UnavailableReason.NOT_IMPORTED;
            for (String code : distinct) {
                descriptions.put(code, "");
            }
            MappingSummary summary = new MappingSummary(0, distinct.size(), distinct.size());
            log.warn("Catalog unavailable ({}): {} code(s) left without description", reason.code(), distinct.size());
            return new CatalogMapping(descriptions, summary, Optional.of(new CatalogDiagnostic(reason, distinct.size())));
        }

        int mapped = 0;
        for (String code : distinct) {
            Optional<String> description = snapshot.index().describe(code);
            if (description.isPresent()) {
                mapped++;
            }
            descriptions.put(code, description.orElse(""));
        }
        MappingSummary summary = new MappingSummary(mapped, distinct.size() - mapped, distinct.size());
        log.info("Catalog descriptions mapped: mapped={} unmapped={} total={}",
                summary.mappedCount(), summary.unmappedCount(), summary.totalCount());
        return new CatalogMapping(descriptions, summary, Optional.empty());
    }
}
