package com.fibrepay.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency arithmetic for a single currency with two minor-unit digits.
 */
public final class Money {

    public static final int MINOR_UNIT_SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(MINOR_UNIT_SCALE);

    private Money() {
    }

    /**
     * Round half-up to the minor unit.
     */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(MINOR_UNIT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Pay for a quantity of work at a rate, e.g. 3.335 x 100.00 = 333.50
     */
    public static BigDecimal settledPay(BigDecimal quantity, BigDecimal rate) {
        if (quantity == null || rate == null) {
            return ZERO;
        }
        return round(quantity.multiply(rate));
    }
}
