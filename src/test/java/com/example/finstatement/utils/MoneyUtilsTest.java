package com.example.finstatement.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class MoneyUtilsTest {

    @Test
    void formatsWholeDollars() {
        assertThat(MoneyUtils.format(new BigDecimal("1234567.4"))).isEqualTo("$1,234,567");
        assertThat(MoneyUtils.format(new BigDecimal("0.5"))).isEqualTo("$1");
        assertThat(MoneyUtils.format(new BigDecimal("-500"))).isEqualTo("-$500");
        assertThat(MoneyUtils.format(null)).isEqualTo("n/a");
    }

    @Test
    void parsesUserAmounts() {
        assertThat(MoneyUtils.parse("$1,200")).isEqualByComparingTo("1200");
        assertThat(MoneyUtils.parse("(300)")).isEqualByComparingTo("-300");
        assertThat(MoneyUtils.parse(" ")).isNull();
        assertThatThrownBy(() -> MoneyUtils.parse("abc")).isInstanceOf(IllegalArgumentException.class);
    }
}
