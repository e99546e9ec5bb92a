package com.example.musiccollection.infrastructure.catalog;

import com.example.musiccollection.domain.model.CatalogRelease;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class CatalogListingPage {

    private List<CatalogRelease> items = new ArrayList<>();

    /**
     * {@code pagination.pages} of the response; at least 1.
     */
    private int totalPages = 1;
}
