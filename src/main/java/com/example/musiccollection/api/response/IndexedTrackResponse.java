package com.example.musiccollection.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexedTrackResponse {

    private Long id;
    private String trackTitle;
    private String album;
    private String artist;
    private String source;
}
