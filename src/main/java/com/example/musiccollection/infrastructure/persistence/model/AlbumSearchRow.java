package com.example.musiccollection.infrastructure.persistence.model;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * One album from either collection. Columns the other side lacks come back null.
 */
@Data
public class AlbumSearchRow {

    private String source;

    private Long id;

    private String artist;

    private String albumTitle;

    private String label;

    private String format;

    private Integer year;

    private String thumbUrl;

    private String imageKey;

    private LocalDateTime lastListened;

    private Boolean isNun;

    private Boolean isPhysicalDupe;

    private String physicalTag;
}
