package com.eventbacktest.backtester.domain;

import com.eventbacktest.backtester.domain.data.Bar;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing one daily bar stored in the securities master.
 * This is the persistent version of {@link Bar}.
 */
@Entity
@Table(name = "daily_price", uniqueConstraints = {
        @UniqueConstraint(name = "uk_ticker_price_date", columnNames = { "ticker", "price_date" })
}, indexes = {
        @Index(name = "idx_ticker_price_date", columnList = "ticker, price_date")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyPrice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticker", nullable = false, length = 32)
    private String ticker;

    @Column(name = "price_date", nullable = false)
    private LocalDate priceDate;

    @Column(name = "open_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal openPrice;

    @Column(name = "high_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal highPrice;

    @Column(name = "low_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal lowPrice;

    @Column(name = "close_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal closePrice;

    @Column(name = "volume", nullable = false)
    private Long volume;

    @Column(name = "adj_close_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal adjClosePrice;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Convert entity to domain Bar object.
     */
    public Bar toBar() {
        return Bar.builder()
                .symbol(this.ticker)
                .timestamp(this.priceDate.atStartOfDay())
                .open(this.openPrice)
                .high(this.highPrice)
                .low(this.lowPrice)
                .close(this.closePrice)
                .volume(this.volume)
                .adjClose(this.adjClosePrice)
                .build();
    }

    /**
     * Create entity from domain Bar object.
     */
    public static DailyPrice fromBar(Bar bar) {
        return DailyPrice.builder()
                .ticker(bar.getSymbol())
                .priceDate(bar.getTimestamp().toLocalDate())
                .openPrice(bar.getOpen())
                .highPrice(bar.getHigh())
                .lowPrice(bar.getLow())
                .closePrice(bar.getClose())
                .volume(bar.getVolume())
                .adjClosePrice(bar.getAdjClose())
                .build();
    }
}
