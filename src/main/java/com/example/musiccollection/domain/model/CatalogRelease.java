package com.example.musiccollection.domain.model;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * A release as listed in the catalog's collection or want-list endpoints, before any
 * per-release detail calls.
 */
@Data
public class CatalogRelease {

    private Long releaseId;

    private Long instanceId;

    private Integer folderId;

    private Integer rating;

    private String artist;

    private String title;

    private String label;

    private String format;

    private Integer year;

    private LocalDateTime dateAdded;

    private String thumbUrl;

    private String coverImageUrl;

    private String mediaCondition;

    private String sleeveCondition;

    /**
     * Free-text notes; only the want-list carries them as plain text.
     */
    private String notes;
}
