package com.wbsledger.reports.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HierarchicalCodesTest {

    @Test
    void parentStripsTrailingTwoDigitSegment() {
        assertThat(HierarchicalCodes.parentOf("NL-C-001-01")).contains("NL-C-001");
        assertThat(HierarchicalCodes.parentOf("NL-C-001")).isEmpty();
        assertThat(HierarchicalCodes.parentOf("-01")).isEmpty();
        assertThat(HierarchicalCodes.parentOf("A-0x")).isEmpty();
    }

    @Test
    void childRelationRequiresExactParent() {
        assertThat(HierarchicalCodes.isChildOf("NL-C-001-01", "NL-C-001")).isTrue();
        assertThat(HierarchicalCodes.isChildOf("NL-C-001-01-01", "NL-C-001")).isFalse();
        assertThat(HierarchicalCodes.isChildOf("NL-C-0010", "NL-C-001")).isFalse();
    }

    @Test
    void normalizeTrimsAndRejectsBlank() {
        assertThat(HierarchicalCodes.normalize("  A-01 ")).contains("A-01");
        assertThat(HierarchicalCodes.normalize(" ")).isEmpty();
        assertThat(HierarchicalCodes.normalize(null)).isEmpty();
    }
}
