package com.wbsledger.reports.format;

import com.wbsledger.reports.config.ReportsProperties;
import com.wbsledger.reports.model.FormattedAmount;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Formats amounts with South-Asian digit grouping: the last three integer digits form
 * one group and the rest are grouped in pairs ({@code 12345678 -> 1,23,45,678.00}).
 * Fractions are rounded half-up to two places.
 *
 * <p>Never throws for cell input: empty cells format as zero and unreadable cells
 * yield the configured fallback literal.
 */
@Component
public class IndianCurrencyFormatter {

    private static final Logger log = LoggerFactory.getLogger(IndianCurrencyFormatter.class);

    private final String symbol;
    private final SignPlacement signPlacement;
    private final String fallback;

    @Autowired
    public IndianCurrencyFormatter(ReportsProperties properties) {
        this(properties.currency().symbol(), properties.currency().signPlacement(), properties.currency().fallback());
    }

    public IndianCurrencyFormatter(String symbol, SignPlacement signPlacement, String fallback) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol must be provided");
        }
        if (signPlacement == null) {
            throw new IllegalArgumentException("signPlacement must be provided");
        }
        this.symbol = symbol;
        this.signPlacement = signPlacement;
        this.fallback = fallback != null ? fallback : format(BigDecimal.ZERO);
    }

    public String format(BigDecimal amount) {
        BigDecimal rounded = (amount == null ? BigDecimal.ZERO : amount).setScale(2, RoundingMode.HALF_UP);
        boolean negative = rounded.signum() < 0;
        String plain = rounded.abs().toPlainString();
        int dot = plain.indexOf('.');
        String grouped = group(plain.substring(0, dot)) + plain.substring(dot);
        String prefix = symbol.isEmpty() ? "" : symbol + " ";
        if (!negative) {
            return prefix + grouped;
        }
        return signPlacement == SignPlacement.BEFORE_SYMBOL
                ? "-" + prefix + grouped
                : prefix + "-" + grouped;
    }

    /**
     * Formats a raw cell value; {@link FormattedAmount#fallback()} marks unreadable input.
     */
    public FormattedAmount formatCell(String raw) {
        if (raw == null || raw.isBlank()) {
            return new FormattedAmount(null, format(BigDecimal.ZERO), false);
        }
        try {
            BigDecimal amount = AmountParser.parse(raw, symbol);
            return new FormattedAmount(amount, format(amount), false);
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Amount cell '{}' not formatted: {}", raw, e.getMessage());
            return new FormattedAmount(null, fallback, true);
        }
    }

    public String fallback() {
        return fallback;
    }

    static String group(String digits) {
        int length = digits.length();
        if (length <= 3) {
            return digits;
        }
        StringBuilder sb = new StringBuilder(length + length / 2);
        int head = (length - 3) % 2;
        if (head == 0) {
            head = 2;
        }
        sb.append(digits, 0, head);
        for (int i = head; i < length - 3; i += 2) {
            sb.append(',').append(digits, i, i + 2);
        }
        sb.append(',').append(digits, length - 3, length);
        return sb.toString();
    }
}
