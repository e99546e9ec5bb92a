package com.example.musiccollection.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackIndexStats {

    private long totalRows;

    private long distinctTitles;

    private long libraryRows;

    private long catalogRows;
}
