package com.example.musiccollection.infrastructure.persistence.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Data;

@Data
public class WantlistEntity {

    private Long id;

    private Long releaseId;

    private String artist;

    private String albumTitle;

    private String label;

    private String format;

    private Integer year;

    private LocalDateTime dateAdded;

    private String notes;

    private Integer numForSale;

    private BigDecimal lowestPrice;

    private Boolean available;

    private String marketplaceUrl;

    private String thumbUrl;

    private String coverImageUrl;

    private LocalDateTime updatedAt;
}
