package com.example.musiccollection.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class PlayHistoryEntity {

    private Long id;

    private String albumArtist;

    private String album;

    private Integer discNumber;

    private Integer trackNumber;

    private String trackTitle;

    private String trackArtists;

    private String composers;

    private String externalId;

    private String source;

    private LocalDateTime playedAt;

    private LocalDateTime createdAt;
}
