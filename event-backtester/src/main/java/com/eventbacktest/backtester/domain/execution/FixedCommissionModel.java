package com.eventbacktest.backtester.domain.execution;

import java.math.BigDecimal;

/**
 * Flat fee per fill.
 */
public class FixedCommissionModel implements CommissionModel {

    private final BigDecimal fee;

    public FixedCommissionModel(BigDecimal fee) {
        if (fee == null || fee.signum() < 0) {
            throw new IllegalArgumentException("Commission fee must be zero or positive");
        }
        this.fee = fee;
    }

    public static FixedCommissionModel zero() {
        return new FixedCommissionModel(BigDecimal.ZERO);
    }

    @Override
    public BigDecimal calculate(long quantity, BigDecimal fillPrice) {
        return fee;
    }
}
