package com.example.musiccollection.domain.enumtype;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Logical sources tracked in the {@code keep_track} ledger. Declaration order is the run order:
 * tag flags read album rows, and the track index reads both track tables.
 */
public enum SyncSourceId {

    ROON_ALBUMS("roon_albums", SourceType.API, true),
    ROON_TAGS("roon_tags", SourceType.API, true),
    DISCOGS_COLLECTION("discogs_collection", SourceType.API, true),
    DISCOGS_TRACKS("discogs_tracks", SourceType.API, false),
    DISCOGS_WANTLIST("discogs_wantlist", SourceType.API, true),
    ROON_TRACKS("roon_tracks", SourceType.FILE, true),
    ROON_PLAY_HISTORY("roon_play_history", SourceType.FILE, true),
    TRACK_INDEX("track_index", SourceType.API, true);

    private final String ledgerName;
    private final SourceType sourceType;
    private final boolean runnable;

    SyncSourceId(String ledgerName, SourceType sourceType, boolean runnable) {
        this.ledgerName = ledgerName;
        this.sourceType = sourceType;
        this.runnable = runnable;
    }

    public String getLedgerName() {
        return ledgerName;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    /**
     * False for ledger-only rows written as a side effect of another source's sync.
     */
    public boolean isRunnable() {
        return runnable;
    }

    public static Set<SyncSourceId> runnableSources() {
        EnumSet<SyncSourceId> sources = EnumSet.noneOf(SyncSourceId.class);
        for (SyncSourceId id : values()) {
            if (id.runnable) {
                sources.add(id);
            }
        }
        return Collections.unmodifiableSet(sources);
    }

    public static List<SyncSourceId> runOrder() {
        return Collections.unmodifiableList(Arrays.asList(values()));
    }

    /**
     * Accepts the ledger name ({@code roon_albums}), the enum name or a dashed form
     * ({@code roon-albums}), case-insensitively.
     */
    public static SyncSourceId fromName(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Sync source must not be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SyncSourceId id : values()) {
            if (id.ledgerName.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown sync source: " + value);
    }
}
