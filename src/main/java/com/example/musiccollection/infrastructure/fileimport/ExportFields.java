package com.example.musiccollection.infrastructure.fileimport;

import java.util.Locale;

/**
 * Column names shared by the library's track CSV and play-history JSON exports, and the value
 * coercions both apply.
 */
final class ExportFields {

    static final String ALBUM_ARTIST = "Album Artist";
    static final String ALBUM = "Album";
    static final String DISC_NUMBER = "Disc#";
    static final String TRACK_NUMBER = "Track#";
    static final String TITLE = "Title";
    static final String TRACK_ARTISTS = "Track Artist(s)";
    static final String COMPOSERS = "Composer(s)";
    static final String EXTERNAL_ID = "External Id";
    static final String SOURCE = "Source";
    static final String IS_DUPLICATE = "Is Dup?";
    static final String IS_HIDDEN = "Is Hidden?";
    static final String TAGS = "Tags";
    static final String PLAYED_AT = "Played At";
    static final String DATE = "Date";

    private ExportFields() {
    }

    static Integer toInteger(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static boolean isYes(String value) {
        return value != null && "yes".equals(value.trim().toLowerCase(Locale.ROOT));
    }

    /** Empty strings become null, everything else is cut to {@code maxLength}. */
    static String optional(String value, int maxLength) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return limit(value, maxLength);
    }

    /** Null becomes "", everything else is cut to {@code maxLength}. */
    static String required(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return limit(value, maxLength);
    }

    private static String limit(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
