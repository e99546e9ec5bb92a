package com.example.musiccollection.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarketplaceStats {

    private Integer numForSale;

    /**
     * Null when nothing is listed.
     */
    private BigDecimal lowestPrice;

    private String currency;

    private boolean blockedFromSale;
}
