package com.example.musiccollection.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryBrowseResult {

    private String action;

    private String listTitle;

    private int listCount;
}
