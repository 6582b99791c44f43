package com.eventbacktest.backtester.domain.strategy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HedgeRatioRegressionTest {

    private static final double EPS = 1e-9;

    @Test
    void testHedgeRatioOfExactlyProportionalSeries() {
        double[] x = { 1, 2, 3, 4 };
        double[] y = { 2.5, 5, 7.5, 10 };

        assertEquals(2.5, HedgeRatioRegression.hedgeRatio(y, x), EPS);
    }

    @Test
    void testHedgeRatioIsThroughTheOrigin() {
        // With an intercept the slope would be 1; through the origin it is sum(xy)/sum(xx)
        double[] x = { 1, 2 };
        double[] y = { 11, 12 };

        assertEquals((11 + 24) / 5.0, HedgeRatioRegression.hedgeRatio(y, x), EPS);
    }

    @Test
    void testHedgeRatioIsNaNForZeroX() {
        assertTrue(Double.isNaN(HedgeRatioRegression.hedgeRatio(new double[] { 1, 2 }, new double[] { 0, 0 })));
    }

    @Test
    void testMismatchedLengthsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> HedgeRatioRegression.hedgeRatio(new double[] { 1 }, new double[] { 1, 2 }));
    }

    @Test
    void testZScoreUsesPopulationStandardDeviation() {
        // mean 0, population std 3
        double[] spread = { -1, -1, -1, -1, -1, -1, -1, -1, -1, 9 };

        assertEquals(3.0, HedgeRatioRegression.zScoreOfLast(spread), EPS);
    }

    @Test
    void testZScoreIsNaNWithoutDispersion() {
        assertTrue(Double.isNaN(HedgeRatioRegression.zScoreOfLast(new double[] { 4, 4, 4 })));
    }

    @Test
    void testSpreadSubtractsScaledX() {
        double[] spread = HedgeRatioRegression.spread(new double[] { 10, 20 }, new double[] { 2, 4 }, 2.0);

        assertArrayEquals(new double[] { 6, 12 }, spread, EPS);
    }
}
