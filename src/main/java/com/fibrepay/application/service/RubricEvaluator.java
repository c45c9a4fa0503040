package com.fibrepay.application.service;

import com.fibrepay.domain.model.RubricResult;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scores a day's combing and weaving against the daily combing-equivalent target.
 * Weaving converts to combing at a fixed number of metres per kilogram.
 */
public class RubricEvaluator {

    public static final BigDecimal DEFAULT_DAILY_TARGET_KG = new BigDecimal("1.0");
    public static final BigDecimal DEFAULT_METRES_PER_KG = new BigDecimal("60.0");

    private static final int SCALE = 6;

    private final BigDecimal dailyTargetKg;
    private final BigDecimal metresPerKg;

    public RubricEvaluator() {
        this(DEFAULT_DAILY_TARGET_KG, DEFAULT_METRES_PER_KG);
    }

    public RubricEvaluator(BigDecimal dailyTargetKg, BigDecimal metresPerKg) {
        if (dailyTargetKg == null || dailyTargetKg.signum() <= 0) {
            throw new IllegalArgumentException("daily target must be positive");
        }
        if (metresPerKg == null || metresPerKg.signum() <= 0) {
            throw new IllegalArgumentException("metres per kg must be positive");
        }
        this.dailyTargetKg = dailyTargetKg;
        this.metresPerKg = metresPerKg;
    }

    public RubricResult evaluate(BigDecimal combedKg, BigDecimal wovenM) {
        BigDecimal combed = combedKg != null ? combedKg : BigDecimal.ZERO;
        BigDecimal woven = wovenM != null ? wovenM : BigDecimal.ZERO;

        BigDecimal progress = combed.add(toKg(woven));
        boolean targetMet = progress.compareTo(dailyTargetKg) >= 0;

        BigDecimal weavingNeeded = BigDecimal.ZERO;
        if (combed.compareTo(dailyTargetKg) < 0) {
            weavingNeeded = dailyTargetKg.subtract(combed).multiply(metresPerKg);
        }

        BigDecimal combingNeeded = BigDecimal.ZERO;
        if (woven.compareTo(metresPerKg) < 0) {
            combingNeeded = toKg(metresPerKg.subtract(woven));
        }

        return new RubricResult(
                progress.stripTrailingZeros(),
                targetMet,
                floorAtZero(weavingNeeded),
                floorAtZero(combingNeeded)
        );
    }

    private BigDecimal toKg(BigDecimal metres) {
        return metres.divide(metresPerKg, SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal floorAtZero(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }
}
