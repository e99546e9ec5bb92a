package com.example.musiccollection.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlbumPlayCountResponse {

    private String artist;
    private String album;
    private long playCount;
}
