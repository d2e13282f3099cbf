package com.panwatch.entity;

import com.panwatch.domain.enums.TradingStyle;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the positions table; one row per account and instrument. */
@Entity
@Table(
        name = "positions",
        uniqueConstraints = @UniqueConstraint(name = "uk_position_account_instrument",
                columnNames = {"account_id", "instrument_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "instrument_id", nullable = false)
    private Long instrumentId;

    @Column(name = "cost_price", nullable = false, precision = 15, scale = 4)
    private BigDecimal costPrice;

    private int quantity;

    @Column(name = "invested_amount", precision = 15, scale = 2)
    private BigDecimal investedAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_style", length = 10)
    private TradingStyle tradingStyle;
}
