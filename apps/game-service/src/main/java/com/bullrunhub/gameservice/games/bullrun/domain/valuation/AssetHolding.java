package com.bullrunhub.gameservice.games.bullrun.domain.valuation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssetHolding {
    private double quantity;
    private double avgPrice;
    private double totalInvested;

    public static AssetHolding of(double quantity) {
        return new AssetHolding(quantity, 0, 0);
    }
}
