package com.bullrunhub.gameservice.games.bullrun.infrastructure.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 历史日线收盘价
 * 对应数据库表：asset_prices（只读）
 */
@Entity
@Table(name = "asset_prices")
@IdClass(AssetPrice.Key.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssetPrice {

    @Id
    @Column(name = "asset_name", nullable = false)
    private String assetName;

    @Id
    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "close_price")
    private BigDecimal closePrice;

    /** 复合主键 (asset_name, date) */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String assetName;
        private LocalDate date;
    }
}
