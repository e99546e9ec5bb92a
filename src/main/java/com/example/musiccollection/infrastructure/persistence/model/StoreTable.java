package com.example.musiccollection.infrastructure.persistence.model;

/**
 * Tables whose row counts are reported. The enum is the only way a table name reaches the
 * count query, which splices it into the SQL text.
 */
public enum StoreTable {
    ROON_ALBUMS("roon_albums"),
    ROON_TRACKS("roon_tracks"),
    ROON_PLAY_HISTORY("roon_play_history"),
    DISCOGS_COLLECTION("discogs_collection"),
    DISCOGS_TRACKS("discogs_tracks"),
    DISCOGS_WANTLIST("discogs_wantlist"),
    TRACK_INDEX("track_index"),
    LISTENING_HISTORY("listening_history");

    private final String tableName;

    StoreTable(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
