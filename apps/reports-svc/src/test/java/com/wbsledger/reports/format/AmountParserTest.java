package com.wbsledger.reports.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class AmountParserTest {

    @Test
    void readsGroupedAndSymbolPrefixedAmounts() {
        assertThat(AmountParser.parse("1,23,456.50", "₹")).isEqualByComparingTo("123456.50");
        assertThat(AmountParser.parse("₹ 500", "₹")).isEqualByComparingTo("500");
        assertThat(AmountParser.parse(" 1 000 ", "₹")).isEqualByComparingTo("1000");
        assertThat(AmountParser.parse(".5", "₹")).isEqualByComparingTo("0.5");
    }

    @Test
    void readsNegativeForms() {
        assertThat(AmountParser.parse("-12", "₹")).isEqualByComparingTo("-12");
        assertThat(AmountParser.parse("500.00-", "₹")).isEqualByComparingTo("-500");
        assertThat(AmountParser.parse("(500.00)", "₹")).isEqualByComparingTo(new BigDecimal("-500"));
    }

    @Test
    void rejectsNonNumericValues() {
        assertThatThrownBy(() -> AmountParser.parse("n/a", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse("-", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse("1.2.3", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse(null, "₹")).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void rejectsConflictingSigns() {
        assertThatThrownBy(() -> AmountParser.parse("-500-", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse("(-500)", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse("(+500)", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse("+500-", "₹")).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void rejectsAmountsBeyondThirtyDigits() {
        assertThat(AmountParser.parse("1E29", "₹")).isEqualByComparingTo("100000000000000000000000000000");
        assertThatThrownBy(() -> AmountParser.parse("1E30", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse("1E999999999", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse("1E-999999999", "₹")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> AmountParser.parse("1234567890123456789012345678901", "₹"))
                .isInstanceOf(NumberFormatException.class);
    }
}
