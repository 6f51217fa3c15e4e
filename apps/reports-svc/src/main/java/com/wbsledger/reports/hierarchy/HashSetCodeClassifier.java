package com.wbsledger.reports.hierarchy;

import com.wbsledger.reports.model.ClassificationResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Linear classifier: every code names its would-be parent by stripping a trailing
 * {@code -DD}; a parent present in the set is a summary code.
 */
@Component
public class HashSetCodeClassifier implements CodeClassifier {

    private static final Logger log = LoggerFactory.getLogger(HashSetCodeClassifier.class);

    @Override
    public ClassificationResult classify(Collection<String> codes) {
        Set<String> distinct = distinct(codes);
        if (distinct.isEmpty()) {
            log.debug("No codes to classify");
            return ClassificationResult.EMPTY;
        }
        Set<String> parents = new HashSet<>();
        for (String code : distinct) {
            HierarchicalCodes.parentOf(code)
                    .filter(distinct::contains)
                    .ifPresent(parents::add);
        }
        List<String> summary = new ArrayList<>(parents.size());
        List<String> leaf = new ArrayList<>(distinct.size() - parents.size());
        for (String code : distinct) {
            if (parents.contains(code)) {
                summary.add(code);
            } else {
                leaf.add(code);
            }
        }
        log.info("Code classification completed: {} summary, {} leaf", summary.size(), leaf.size());
        return new ClassificationResult(summary, leaf);
    }

    static Set<String> distinct(Collection<String> codes) {
        Set<String> distinct = new LinkedHashSet<>();
        if (codes != null) {
            for (String raw : codes) {
                HierarchicalCodes.normalize(raw).ifPresent(distinct::add);
            }
        }
        return distinct;
    }
}
