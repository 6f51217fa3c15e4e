package com.wbsledger.reports.format;

import java.math.BigDecimal;

/**
 * Reads amounts as they appear in report exports: {@code 1,234.50}, {@code ₹ 500},
 * {@code -12}, the trailing-minus form {@code 500.00-} and {@code (500.00)}.
 * A sign inside parentheses or before a trailing minus is rejected, as are values
 * with more than {@value #MAX_DIGITS} integer or fraction digits.
 */
public final class AmountParser {

    static final int MAX_DIGITS = 30;

    private AmountParser() {
    }

    /**
     * @throws NumberFormatException when the value is not an amount
     */
    public static BigDecimal parse(String raw, String symbol) {
        if (raw == null) {
            throw new NumberFormatException("null amount");
        }
        String value = raw.trim();
        if (symbol != null && !symbol.isEmpty()) {
            value = value.replace(symbol, "");
        }
        value = value.replace(",", "").replace(" ", "").replace("\u00A0", "");
        boolean negative = false;
        if (value.startsWith("(") && value.endsWith(")") && value.length() > 2) {
            negative = true;
            value = value.substring(1, value.length() - 1);
        } else if (value.endsWith("-") && value.length() > 1) {
            negative = true;
            value = value.substring(0, value.length() - 1);
        }
        if (negative && (value.startsWith("-") || value.startsWith("+"))) {
            throw new NumberFormatException("conflicting signs: '" + raw + "'");
        }
        if (value.isEmpty() || !value.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
            throw new NumberFormatException("not an amount: '" + raw + "'");
        }
        BigDecimal amount = new BigDecimal(value);
        if (amount.precision() - amount.scale() > MAX_DIGITS || amount.scale() > MAX_DIGITS) {
            throw new NumberFormatException("amount out of range: '" + raw + "'");
        }
        return negative ? amount.negate() : amount;
    }
}
