package com.wbsledger.reports.hierarchy;

import com.wbsledger.reports.model.ClassificationResult;
import java.util.Collection;

public interface CodeClassifier {

    /**
     * Splits the distinct, non-blank codes of {@code codes} into summary and leaf codes.
     * Values are trimmed; comparison is otherwise exact and case-sensitive.
     */
    ClassificationResult classify(Collection<String> codes);
}
