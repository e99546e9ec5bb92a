package com.example.musiccollection.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BootlegArtistResponse {

    private String artist;
    private long showCount;
}
