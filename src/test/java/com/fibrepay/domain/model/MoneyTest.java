package com.fibrepay.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    void settledPay_roundsHalfUpToMinorUnit() {
        assertEquals(new BigDecimal("333.50"), Money.settledPay(new BigDecimal("3.335"), new BigDecimal("100.00")));
        assertEquals(new BigDecimal("0.01"), Money.settledPay(new BigDecimal("0.001"), new BigDecimal("5.00")));
        assertEquals(new BigDecimal("0.00"), Money.settledPay(new BigDecimal("0.001"), new BigDecimal("4.00")));
    }

    @Test
    void settledPay_missingInputIsZero() {
        assertEquals(Money.ZERO, Money.settledPay(null, new BigDecimal("5.00")));
        assertEquals(Money.ZERO, Money.settledPay(BigDecimal.ONE, null));
    }

    @Test
    void round_keepsTwoDecimals() {
        assertEquals(new BigDecimal("10.00"), Money.round(BigDecimal.TEN));
        assertEquals(new BigDecimal("2.35"), Money.round(new BigDecimal("2.345")));
        assertEquals(Money.ZERO, Money.round(null));
    }
}
