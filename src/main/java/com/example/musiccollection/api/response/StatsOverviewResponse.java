package com.example.musiccollection.api.response;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@Data
public class StatsOverviewResponse {

    /**
     * Row count per store table, keyed by table name.
     */
    private Map<String, Long> tableCounts = new LinkedHashMap<>();

    /**
     * Albums present in both the library and the catalog collection.
     */
    private long overlapAlbums;

    /**
     * Catalog items whose library counterpart is flagged as a physical copy.
     */
    private long ownedPhysicalDuplicates;

    /**
     * Library albums flagged as physical copies, per tag.
     */
    private Map<String, Long> physicalCopiesByTag = new LinkedHashMap<>();

    private long nunFlagged;

    /**
     * Sum of the lowest listed price over the want-list; null when nothing is listed.
     */
    private BigDecimal wantlistLowestPriceTotal;
}
