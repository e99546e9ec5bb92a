package com.example.musiccollection.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaggedAlbum {

    private String albumTitle;

    private String tagName;
}
