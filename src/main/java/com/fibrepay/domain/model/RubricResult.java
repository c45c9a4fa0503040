package com.fibrepay.domain.model;

import java.math.BigDecimal;

/**
 * Daily progress against the combing-equivalent target.
 *
 * @param progressKgEquiv combed kilograms plus woven metres converted to kilograms
 * @param targetMet       progress reached the daily target
 * @param weavingNeededM  metres of weaving still needed if only combing counted
 * @param combingNeededKg kilograms of combing still needed if only weaving counted
 */
public record RubricResult(
        BigDecimal progressKgEquiv,
        boolean targetMet,
        BigDecimal weavingNeededM,
        BigDecimal combingNeededKg
) {
}
