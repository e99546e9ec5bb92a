package com.example.musiccollection.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BootlegAlbumResponse {

    private Long id;
    private String artist;
    private String albumTitle;
    private String imageKey;
    /** Leading {@code YYYY MM/DD} of the title. */
    private String showDate;
}
