package com.wbsledger.reports.format;

/**
 * Where the minus sign of a negative amount goes relative to the currency symbol.
 */
public enum SignPlacement {
    /** {@code -₹ 5,000.00} */
    BEFORE_SYMBOL,
    /** {@code ₹ -5,000.00} */
    AFTER_SYMBOL
}
