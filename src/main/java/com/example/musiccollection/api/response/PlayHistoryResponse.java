package com.example.musiccollection.api.response;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class PlayHistoryResponse {

    private Long id;
    private LocalDateTime playedAt;
    private String albumArtist;
    private String album;
    private Integer discNumber;
    private Integer trackNumber;
    private String trackTitle;
    private String trackArtists;
    private String source;
}
