package com.example.musiccollection.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of a browse list. For album lists {@code subtitle} carries the artist.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryBrowseItem {

    private String title;

    private String subtitle;

    private String itemKey;

    private String imageKey;

    private String hint;
}
