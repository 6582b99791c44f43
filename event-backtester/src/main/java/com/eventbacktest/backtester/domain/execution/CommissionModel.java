package com.eventbacktest.backtester.domain.execution;

import java.math.BigDecimal;

/**
 * Commission charged for a fill.
 */
public interface CommissionModel {

    /**
     * @param quantity  units filled
     * @param fillPrice price per unit
     * @return commission, never negative
     */
    BigDecimal calculate(long quantity, BigDecimal fillPrice);
}
