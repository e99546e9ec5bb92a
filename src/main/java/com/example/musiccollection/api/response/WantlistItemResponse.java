package com.example.musiccollection.api.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Data;

@Data
public class WantlistItemResponse {

    private Long id;
    private Long releaseId;
    private String artist;
    private String albumTitle;
    private String format;
    private Integer year;
    private LocalDateTime dateAdded;
    private Integer numForSale;
    private BigDecimal lowestPrice;
    private boolean available;
    private String marketplaceUrl;
    private String thumbUrl;
}
