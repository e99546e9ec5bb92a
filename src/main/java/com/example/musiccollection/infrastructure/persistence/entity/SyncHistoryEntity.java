package com.example.musiccollection.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncHistoryEntity {

    private Long id;

    private LocalDateTime syncDate;

    private long roonAlbums;

    private long roonTracks;

    private long roonPlayHistory;

    private long discogsCollection;

    private long discogsTracks;

    private long discogsWantlist;

    private long trackIndexTotal;

    private long trackIndexDistinct;

    private long listeningHistory;
}
