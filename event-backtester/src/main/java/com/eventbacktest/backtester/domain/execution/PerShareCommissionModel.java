package com.eventbacktest.backtester.domain.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tiered per-share broker commission: 0.013 per share up to 500 shares,
 * 0.008 per share above, with a 1.30 minimum and a cap of 0.5% of trade value.
 */
public class PerShareCommissionModel implements CommissionModel {

    private static final long TIER_THRESHOLD = 500;
    private static final BigDecimal LOW_TIER_RATE = new BigDecimal("0.013");
    private static final BigDecimal HIGH_TIER_RATE = new BigDecimal("0.008");
    private static final BigDecimal MINIMUM = new BigDecimal("1.30");
    private static final BigDecimal MAX_FRACTION_OF_VALUE = new BigDecimal("0.005");

    @Override
    public BigDecimal calculate(long quantity, BigDecimal fillPrice) {
        BigDecimal rate = quantity <= TIER_THRESHOLD ? LOW_TIER_RATE : HIGH_TIER_RATE;
        BigDecimal commission = rate.multiply(BigDecimal.valueOf(quantity)).max(MINIMUM);

        if (fillPrice != null && fillPrice.signum() > 0) {
            BigDecimal cap = fillPrice.multiply(BigDecimal.valueOf(quantity)).multiply(MAX_FRACTION_OF_VALUE);
            commission = commission.min(cap);
        }
        return commission.setScale(4, RoundingMode.HALF_UP);
    }
}
