package com.example.musiccollection.infrastructure.catalog;

import com.example.musiccollection.domain.model.CatalogRelease;
import com.example.musiccollection.domain.model.CatalogTrack;
import com.example.musiccollection.domain.model.MarketplaceStats;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps catalog JSON payloads onto domain objects. Missing fields become null rather than errors;
 * only unreadable JSON throws.
 */
@Component
public class CatalogPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(CatalogPayloadParser.class);

    private static final String UNKNOWN = "Unknown";
    private static final int FIELD_MEDIA_CONDITION = 1;
    private static final int FIELD_SLEEVE_CONDITION = 2;

    private final ObjectMapper objectMapper;

    public CatalogPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param arrayField {@code releases} for the collection, {@code wants} for the want-list
     */
    public CatalogListingPage parseListingPage(String body, String arrayField) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        CatalogListingPage page = new CatalogListingPage();
        page.setTotalPages(Math.max(1, root.path("pagination").path("pages").asInt(1)));
        for (JsonNode item : root.path(arrayField)) {
            page.getItems().add(toRelease(item));
        }
        return page;
    }

    public MarketplaceStats parseStats(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        MarketplaceStats stats = new MarketplaceStats();
        stats.setNumForSale(root.hasNonNull("num_for_sale") ? root.get("num_for_sale").asInt() : null);
        JsonNode lowest = root.path("lowest_price");
        if (lowest.hasNonNull("value")) {
            stats.setLowestPrice(lowest.get("value").decimalValue().setScale(2, RoundingMode.HALF_UP));
            stats.setCurrency(lowest.path("currency").asText(null));
        }
        stats.setBlockedFromSale(root.path("blocked_from_sale").asBoolean(false));
        return stats;
    }

    public List<CatalogTrack> parseTracklist(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        List<CatalogTrack> tracks = new ArrayList<>();
        for (JsonNode track : root.path("tracklist")) {
            tracks.add(new CatalogTrack(
                    track.path("position").asText(""),
                    track.path("title").asText(""),
                    track.path("duration").asText(""),
                    joinNames(track.path("artists")),
                    joinNames(track.path("extraartists"))));
        }
        return tracks;
    }

    private CatalogRelease toRelease(JsonNode item) {
        JsonNode basic = item.path("basic_information");
        CatalogRelease release = new CatalogRelease();
        release.setReleaseId(item.path("id").asLong());
        release.setInstanceId(item.hasNonNull("instance_id") ? item.get("instance_id").asLong() : null);
        release.setFolderId(item.hasNonNull("folder_id") ? item.get("folder_id").asInt() : null);
        release.setRating(item.hasNonNull("rating") ? item.get("rating").asInt() : null);
        release.setArtist(firstName(basic.path("artists"), UNKNOWN));
        release.setTitle(basic.path("title").asText(UNKNOWN));
        release.setLabel(firstName(basic.path("labels"), null));
        release.setFormat(firstName(basic.path("formats"), null));
        release.setYear(basic.hasNonNull("year") ? basic.get("year").asInt() : null);
        release.setThumbUrl(basic.path("thumb").asText(null));
        release.setCoverImageUrl(basic.path("cover_image").asText(null));
        release.setDateAdded(parseDateAdded(release.getReleaseId(), item.path("date_added").asText(null)));

        JsonNode notes = item.path("notes");
        if (notes.isArray()) {
            for (JsonNode note : notes) {
                int fieldId = note.path("field_id").asInt(-1);
                if (fieldId == FIELD_MEDIA_CONDITION) {
                    release.setMediaCondition(note.path("value").asText(null));
                } else if (fieldId == FIELD_SLEEVE_CONDITION) {
                    release.setSleeveCondition(note.path("value").asText(null));
                }
            }
        } else if (notes.isTextual()) {
            release.setNotes(notes.asText());
        }
        return release;
    }

    private LocalDateTime parseDateAdded(Long releaseId, String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.warn("CATALOG_DATE_UNPARSEABLE releaseId={} value={}", releaseId, value);
            return null;
        }
    }

    private String firstName(JsonNode array, String fallback) {
        if (array.isArray() && array.size() > 0) {
            return array.get(0).path("name").asText(fallback);
        }
        return fallback;
    }

    private String joinNames(JsonNode array) {
        if (!array.isArray() || array.size() == 0) {
            return null;
        }
        StringJoiner joiner = new StringJoiner(", ");
        for (JsonNode artist : array) {
            String name = artist.path("name").asText("");
            if (!name.isEmpty()) {
                joiner.add(name);
            }
        }
        String joined = joiner.toString();
        return joined.isEmpty() ? null : joined;
    }
}
