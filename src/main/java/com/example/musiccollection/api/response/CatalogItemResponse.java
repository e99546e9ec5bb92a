package com.example.musiccollection.api.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Data;

@Data
public class CatalogItemResponse {

    private Long id;
    private Long releaseId;
    private String artist;
    private String albumTitle;
    private String label;
    private String format;
    private Integer year;
    private LocalDateTime dateAdded;
    private Integer rating;
    private Integer numForSale;
    private BigDecimal lowestPrice;
    private String thumbUrl;
    private String coverImageUrl;
    private String mediaCondition;
    private String sleeveCondition;
    private LocalDateTime lastListened;
    private boolean nun;
    private String notes;
}
