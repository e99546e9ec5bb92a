package com.example.musiccollection.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ListeningHistoryEntity {

    private Long id;

    private String artist;

    private String album;

    /**
     * One of {@code roon}, {@code discogs}, {@code both}.
     */
    private String source;

    private LocalDateTime listenedAt;

    private String format;

    private String notes;

    private Long discogsCollectionId;

    private Long roonAlbumId;

    private LocalDateTime createdAt;
}
