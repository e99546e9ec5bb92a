package com.example.musiccollection.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListeningHistoryResponse {

    private Long id;
    private String artist;
    private String album;
    private String source;
    private LocalDateTime listenedAt;
    private String format;
    private String notes;
    private Long discogsCollectionId;
    private Long roonAlbumId;
}
