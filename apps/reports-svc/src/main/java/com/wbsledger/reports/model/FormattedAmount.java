package com.wbsledger.reports.model;

import java.math.BigDecimal;

/**
 * A parsed amount and its display string. {@code amount} is null when the cell was
 * empty or could not be read as a number; {@code fallback} marks the latter.
 */
public record FormattedAmount(BigDecimal amount, String display, boolean fallback) {

    public FormattedAmount {
        if (display == null) {
            throw new IllegalArgumentException("display must be provided");
        }
    }

    public boolean isNegative() {
        return amount != null && amount.signum() < 0;
    }
}
