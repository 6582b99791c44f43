package com.eventbacktest.backtester.domain.data;

import com.eventbacktest.backtester.domain.InvalidBarFieldException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.Function;

/**
 * Fields that can be read from a bar, each bound to its extractor.
 */
public enum BarField {

    OPEN("open", Bar::getOpen),
    HIGH("high", Bar::getHigh),
    LOW("low", Bar::getLow),
    CLOSE("close", Bar::getClose),
    VOLUME("volume", bar -> BigDecimal.valueOf(bar.getVolume())),
    ADJ_CLOSE("adj_close", Bar::getAdjClose);

    private final String fieldName;
    private final Function<Bar, BigDecimal> extractor;

    BarField(String fieldName, Function<Bar, BigDecimal> extractor) {
        this.fieldName = fieldName;
        this.extractor = extractor;
    }

    public String getFieldName() {
        return fieldName;
    }

    public BigDecimal extract(Bar bar) {
        return extractor.apply(bar);
    }

    /**
     * Resolve a field by name. Accepts the enum name, the short column name and
     * "adjusted_close" / "adjclose" for the adjusted close.
     *
     * @throws InvalidBarFieldException if the name matches no field
     */
    public static BarField fromName(String name) {
        if (name == null) {
            throw new InvalidBarFieldException(null);
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "adjusted_close":
            case "adjclose":
            case "adj close":
                return ADJ_CLOSE;
            default:
                break;
        }
        for (BarField field : values()) {
            if (field.fieldName.equals(normalized) || field.name().equalsIgnoreCase(normalized)) {
                return field;
            }
        }
        throw new InvalidBarFieldException(name);
    }
}
