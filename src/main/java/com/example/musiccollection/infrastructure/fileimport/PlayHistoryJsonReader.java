package com.example.musiccollection.infrastructure.fileimport;

import com.example.musiccollection.infrastructure.persistence.entity.PlayHistoryEntity;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Streams the library's play-history export, a JSON array of flat objects, one play each.
 * The array is read element by element so large exports never sit in memory whole.
 */
@Component
public class PlayHistoryJsonReader {

    private static final Logger log = LoggerFactory.getLogger(PlayHistoryJsonReader.class);

    private static final List<DateTimeFormatter> LOCAL_FORMATS = Arrays.asList(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

    private final ObjectMapper objectMapper;

    public PlayHistoryJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ImportStats read(Path file, Consumer<PlayHistoryEntity> sink) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, sink);
        }
    }

    public ImportStats read(InputStream in, Consumer<PlayHistoryEntity> sink) throws IOException {
        ImportStats stats = new ImportStats();
        try (JsonParser parser = objectMapper.getFactory().createParser(in)) {
            JsonToken first = parser.nextToken();
            if (first == null) {
                return stats;
            }
            if (first != JsonToken.START_ARRAY) {
                throw new IOException("Play history export must be a JSON array, found " + first);
            }
            long index = 0;
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    throw new IOException("Play history export ended before the closing bracket");
                }
                long current = index++;
                if (token != JsonToken.START_OBJECT) {
                    log.warn("PLAY_HISTORY_RECORD_SKIPPED index={} reason=not an object token={}", current, token);
                    parser.skipChildren();
                    stats.setRecordsSkipped(stats.getRecordsSkipped() + 1);
                    continue;
                }
                JsonNode record = parser.readValueAsTree();
                PlayHistoryEntity entity = toEntity(record, current);
                if (entity == null) {
                    stats.setRecordsSkipped(stats.getRecordsSkipped() + 1);
                    continue;
                }
                sink.accept(entity);
                stats.setRecordsRead(stats.getRecordsRead() + 1);
            }
        }
        return stats;
    }

    private PlayHistoryEntity toEntity(JsonNode record, long index) {
        PlayHistoryEntity entity = new PlayHistoryEntity();
        String playedAtText = text(record, ExportFields.PLAYED_AT);
        if (playedAtText == null) {
            playedAtText = text(record, ExportFields.DATE);
        }
        if (playedAtText != null && !playedAtText.trim().isEmpty()) {
            LocalDateTime playedAt = parseTimestamp(playedAtText.trim());
            if (playedAt == null) {
                log.warn("PLAY_HISTORY_RECORD_SKIPPED index={} reason=unparseable date value={}", index, playedAtText);
                return null;
            }
            entity.setPlayedAt(playedAt);
        }
        entity.setAlbumArtist(ExportFields.required(text(record, ExportFields.ALBUM_ARTIST), 300));
        entity.setAlbum(ExportFields.required(text(record, ExportFields.ALBUM), 500));
        entity.setDiscNumber(ExportFields.toInteger(text(record, ExportFields.DISC_NUMBER)));
        entity.setTrackNumber(ExportFields.toInteger(text(record, ExportFields.TRACK_NUMBER)));
        entity.setTrackTitle(ExportFields.required(text(record, ExportFields.TITLE), 500));
        entity.setTrackArtists(ExportFields.optional(text(record, ExportFields.TRACK_ARTISTS), 500));
        entity.setComposers(ExportFields.optional(text(record, ExportFields.COMPOSERS), 500));
        entity.setExternalId(ExportFields.optional(text(record, ExportFields.EXTERNAL_ID), 100));
        entity.setSource(ExportFields.required(text(record, ExportFields.SOURCE), 50));
        return entity;
    }

    private String text(JsonNode record, String field) {
        JsonNode node = record.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private LocalDateTime parseTimestamp(String value) {
        LocalDateTime parsed = tryParse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME, true);
        for (int i = 0; parsed == null && i < LOCAL_FORMATS.size(); i++) {
            parsed = tryParse(value, LOCAL_FORMATS.get(i), false);
        }
        return parsed;
    }

    private LocalDateTime tryParse(String value, DateTimeFormatter format, boolean withOffset) {
        try {
            return withOffset
                    ? OffsetDateTime.parse(value, format).toLocalDateTime()
                    : LocalDateTime.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
