package com.eventbacktest.backtester.domain.strategy;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import com.eventbacktest.backtester.domain.data.BarField;
import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.event.MarketEvent;
import com.eventbacktest.backtester.domain.event.SignalDirection;
import com.eventbacktest.backtester.domain.event.SignalEvent;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Pairs mean-reversion strategy on a fixed (y, x) pair.
 *
 * <p>On every bar with a full window it regresses y on x to obtain a hedge
 * ratio and scores the latest residual against the window. Entries happen at
 * |z| >= zscoreHigh from flat; exits at |z| <= zscoreLow. Each transition
 * emits one signal per leg, y first. Entry legs on x are sized by the
 * absolute hedge ratio.
 */
@Slf4j
public class PairsMeanReversionStrategy implements Strategy {

    private final String strategyId;
    private final BarSource bars;
    private final EventQueue events;
    private final String ySymbol;
    private final String xSymbol;
    private final int olsWindow;
    private final double zscoreLow;
    private final double zscoreHigh;
    private final BarField priceField;

    private boolean longMarket = false;
    private boolean shortMarket = false;
    private double hedgeRatio = Double.NaN;

    public PairsMeanReversionStrategy(String strategyId, BarSource bars, EventQueue events,
                                      String ySymbol, String xSymbol, int olsWindow,
                                      double zscoreLow, double zscoreHigh) {
        this(strategyId, bars, events, ySymbol, xSymbol, olsWindow, zscoreLow, zscoreHigh, BarField.CLOSE);
    }

    public PairsMeanReversionStrategy(String strategyId, BarSource bars, EventQueue events,
                                      String ySymbol, String xSymbol, int olsWindow,
                                      double zscoreLow, double zscoreHigh, BarField priceField) {
        if (olsWindow < 2) {
            throw new IllegalArgumentException("OLS window must be at least 2");
        }
        if (zscoreLow < 0 || zscoreLow >= zscoreHigh) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 <= zscoreLow < zscoreHigh");
        }
        if (!bars.getSymbols().contains(ySymbol) || !bars.getSymbols().contains(xSymbol)) {
            throw new BacktestConfigurationException(String.format(
                    "Pair (%s, %s) is not tracked by the bar source %s", ySymbol, xSymbol, bars.getSymbols()));
        }
        this.strategyId = strategyId;
        this.bars = bars;
        this.events = events;
        this.ySymbol = ySymbol;
        this.xSymbol = xSymbol;
        this.olsWindow = olsWindow;
        this.zscoreLow = zscoreLow;
        this.zscoreHigh = zscoreHigh;
        this.priceField = priceField;
    }

    @Override
    public void calculateSignals(MarketEvent event) {
        List<BigDecimal> y = bars.getLatestBarsValues(ySymbol, priceField, olsWindow);
        List<BigDecimal> x = bars.getLatestBarsValues(xSymbol, priceField, olsWindow);

        if (y.size() < olsWindow || x.size() < olsWindow) {
            return;
        }

        double[] yValues = toDoubles(y);
        double[] xValues = toDoubles(x);

        double ratio = HedgeRatioRegression.hedgeRatio(yValues, xValues);
        if (Double.isNaN(ratio)) {
            return;
        }
        hedgeRatio = ratio;

        double zscore = HedgeRatioRegression.zScoreOfLast(
                HedgeRatioRegression.spread(yValues, xValues, hedgeRatio));
        if (Double.isNaN(zscore)) {
            return;
        }

        applyTransition(zscore, bars.getCurrentDatetime().orElse(null));
    }

    private void applyTransition(double zscore, LocalDateTime timestamp) {
        double absRatio = Math.abs(hedgeRatio);
        boolean flat = !longMarket && !shortMarket;

        if (zscore <= -zscoreHigh && flat) {
            longMarket = true;
            emitPair(timestamp, SignalDirection.LONG, 1.0, SignalDirection.SHORT, absRatio);
            log.debug("Pairs: enter long spread (z={}, hedge ratio={})", zscore, hedgeRatio);
        } else if (Math.abs(zscore) <= zscoreLow && longMarket) {
            longMarket = false;
            emitPair(timestamp, SignalDirection.EXIT, 1.0, SignalDirection.EXIT, 1.0);
            log.debug("Pairs: exit long spread (z={})", zscore);
        } else if (zscore >= zscoreHigh && flat) {
            shortMarket = true;
            emitPair(timestamp, SignalDirection.SHORT, 1.0, SignalDirection.LONG, absRatio);
            log.debug("Pairs: enter short spread (z={}, hedge ratio={})", zscore, hedgeRatio);
        } else if (Math.abs(zscore) <= zscoreLow && shortMarket) {
            shortMarket = false;
            emitPair(timestamp, SignalDirection.EXIT, 1.0, SignalDirection.EXIT, 1.0);
            log.debug("Pairs: exit short spread (z={})", zscore);
        }
    }

    private void emitPair(LocalDateTime timestamp, SignalDirection yDirection, double yStrength,
                          SignalDirection xDirection, double xStrength) {
        events.push(SignalEvent.builder()
                .strategyId(strategyId)
                .symbol(ySymbol)
                .timestamp(timestamp)
                .direction(yDirection)
                .strength(yStrength)
                .build());
        events.push(SignalEvent.builder()
                .strategyId(strategyId)
                .symbol(xSymbol)
                .timestamp(timestamp)
                .direction(xDirection)
                .strength(xStrength)
                .build());
    }

    private static double[] toDoubles(List<BigDecimal> values) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i).doubleValue();
        }
        return result;
    }

    public boolean isLongMarket() {
        return longMarket;
    }

    public boolean isShortMarket() {
        return shortMarket;
    }

    /**
     * Hedge ratio from the latest full window, NaN before the first one.
     */
    public double getHedgeRatio() {
        return hedgeRatio;
    }

    @Override
    public String getName() {
        return "PairsMeanReversion(" + ySymbol + "/" + xSymbol + "," + olsWindow + ","
                + zscoreLow + "," + zscoreHigh + ")";
    }
}
