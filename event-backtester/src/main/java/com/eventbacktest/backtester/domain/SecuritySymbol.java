package com.eventbacktest.backtester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entity representing one instrument in the symbol master list.
 * No uniqueness is enforced on ticker: repeated inserts create repeated rows.
 */
@Entity
@Table(name = "symbol", indexes = {
        @Index(name = "idx_symbol_ticker", columnList = "ticker")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SecuritySymbol {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticker", nullable = false, length = 32)
    private String ticker;

    @Column(name = "instrument", nullable = false, length = 64)
    private String instrument;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "sector", length = 255)
    private String sector;

    @Column(name = "currency", length = 32)
    private String currency;

    @Column(name = "created_date", nullable = false)
    private LocalDateTime createdDate;

    @Column(name = "last_updated_date", nullable = false)
    private LocalDateTime lastUpdatedDate;
}
