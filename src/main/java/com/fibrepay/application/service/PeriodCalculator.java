package com.fibrepay.application.service;

import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.PayoutFrequency;
import com.fibrepay.domain.model.SettlementPeriod;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

/**
 * Maps (payout frequency, anchor date, as-of date) to an inclusive settlement period.
 *
 * <p>Weekly and biweekly periods are 7 or 14 day blocks tiled forward from the
 * anchor. Monthly periods start on the anchor's day-of-month, clamped to the
 * last day of shorter months, and end the day before the next month's anchor day.
 * A worker has no period before the anchor: an as-of date before the anchor
 * resolves to the period that starts on the anchor.
 */
public class PeriodCalculator {

    /**
     * The full period containing asOf. Used to decide settlement eligibility.
     */
    public SettlementPeriod settlementPeriod(PayoutFrequency frequency, LocalDate anchor, LocalDate asOf) {
        requireInputs(frequency, anchor, asOf);

        if (frequency.isFixedBlock()) {
            return fixedBlock(frequency.getBlockDays(), anchor, asOf);
        }
        return monthly(anchor, asOf);
    }

    /**
     * The period containing asOf, cut off at asOf ("period so far").
     * Never shorter than one day.
     */
    public SettlementPeriod currentProgressPeriod(PayoutFrequency frequency, LocalDate anchor, LocalDate asOf) {
        SettlementPeriod full = settlementPeriod(frequency, anchor, asOf);

        LocalDate end = full.end();
        if (asOf.isBefore(end)) {
            end = asOf.isBefore(full.start()) ? full.start() : asOf;
        }
        return new SettlementPeriod(full.start(), end);
    }

    private SettlementPeriod fixedBlock(int blockDays, LocalDate anchor, LocalDate asOf) {
        long offset = ChronoUnit.DAYS.between(anchor, asOf);

        LocalDate start = anchor;
        if (offset > 0) {
            long blockIndex = offset / blockDays;
            start = anchor.plusDays(blockIndex * blockDays);
        }
        return new SettlementPeriod(start, start.plusDays(blockDays - 1L));
    }

    private SettlementPeriod monthly(LocalDate anchor, LocalDate asOf) {
        int anchorDay = anchor.getDayOfMonth();
        LocalDate reference = asOf.isBefore(anchor) ? anchor : asOf;

        YearMonth month = YearMonth.from(reference);
        LocalDate start = anchorDayIn(month, anchorDay);
        if (start.isAfter(reference)) {
            month = month.minusMonths(1);
            start = anchorDayIn(month, anchorDay);
        }

        LocalDate nextStart = anchorDayIn(month.plusMonths(1), anchorDay);
        return new SettlementPeriod(start, nextStart.minusDays(1));
    }

    // Day 31 becomes the 30th, 29th or 28th in shorter months
    private static LocalDate anchorDayIn(YearMonth month, int anchorDay) {
        return month.atDay(Math.min(anchorDay, month.lengthOfMonth()));
    }

    private static void requireInputs(PayoutFrequency frequency, LocalDate anchor, LocalDate asOf) {
        if (frequency == null || anchor == null || asOf == null) {
            throw new ValidationException("payout frequency, anchor date and as-of date are required");
        }
    }
}
