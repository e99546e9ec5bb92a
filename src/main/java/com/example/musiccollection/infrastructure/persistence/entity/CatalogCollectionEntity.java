package com.example.musiccollection.infrastructure.persistence.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Data;

@Data
public class CatalogCollectionEntity {

    private Long id;

    private Long releaseId;

    private Long instanceId;

    private String artist;

    private String albumTitle;

    private String label;

    private String format;

    private Integer year;

    private LocalDateTime dateAdded;

    private Integer rating;

    private Integer folderId;

    private String artistNorm;

    private String albumNorm;

    private String matchKey;

    private Integer numForSale;

    private BigDecimal lowestPrice;

    private String thumbUrl;

    private String coverImageUrl;

    private String mediaCondition;

    private String sleeveCondition;

    private LocalDateTime lastListened;

    private Boolean isNun;

    private String notes;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
