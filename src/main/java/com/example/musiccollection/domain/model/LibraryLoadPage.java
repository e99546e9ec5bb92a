package com.example.musiccollection.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryLoadPage {

    private List<LibraryBrowseItem> items = new ArrayList<>();

    private int totalCount;

    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }
}
