package com.example.musiccollection.infrastructure.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.musiccollection.domain.model.CatalogRelease;
import com.example.musiccollection.domain.model.CatalogTrack;
import com.example.musiccollection.domain.model.MarketplaceStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class CatalogPayloadParserTest {

    private final CatalogPayloadParser parser = new CatalogPayloadParser(new ObjectMapper());

    @Test
    void shouldMapCollectionReleaseWithConditionNotes() throws IOException {
        String body = "{\"pagination\":{\"page\":1,\"pages\":4},\"releases\":[{"
                + "\"id\":123,\"instance_id\":9,\"folder_id\":1,\"rating\":4,"
                + "\"date_added\":\"2023-05-01T10:15:30-07:00\","
                + "\"notes\":[{\"field_id\":1,\"value\":\"Near Mint (NM or M-)\"},{\"field_id\":2,\"value\":\"Very Good Plus (VG+)\"}],"
                + "\"basic_information\":{\"title\":\"The Wall\",\"year\":1979,"
                + "\"artists\":[{\"name\":\"Pink Floyd\"}],\"labels\":[{\"name\":\"Harvest\"}],"
                + "\"formats\":[{\"name\":\"Vinyl\"}],\"thumb\":\"t.jpg\",\"cover_image\":\"c.jpg\"}}]}";

        CatalogListingPage page = parser.parseListingPage(body, "releases");

        assertEquals(4, page.getTotalPages());
        CatalogRelease release = page.getItems().get(0);
        assertEquals(123L, release.getReleaseId().longValue());
        assertEquals("Pink Floyd", release.getArtist());
        assertEquals("The Wall", release.getTitle());
        assertEquals("Harvest", release.getLabel());
        assertEquals("Vinyl", release.getFormat());
        assertEquals(1979, release.getYear().intValue());
        assertEquals(LocalDateTime.of(2023, 5, 1, 10, 15, 30), release.getDateAdded());
        assertEquals("Near Mint (NM or M-)", release.getMediaCondition());
        assertEquals("Very Good Plus (VG+)", release.getSleeveCondition());
        assertNull(release.getNotes());
    }

    @Test
    void shouldFallBackToUnknownAndKeepReleaseWithBadDate() throws IOException {
        String body = "{\"pagination\":{\"pages\":1},\"wants\":[{\"id\":5,\"date_added\":\"yesterday\","
                + "\"notes\":\"look for first press\",\"basic_information\":{}}]}";

        CatalogRelease release = parser.parseListingPage(body, "wants").getItems().get(0);

        assertEquals("Unknown", release.getArtist());
        assertEquals("Unknown", release.getTitle());
        assertNull(release.getDateAdded());
        assertEquals("look for first press", release.getNotes());
    }

    @Test
    void shouldParseStatsWithoutLowestPrice() throws IOException {
        MarketplaceStats stats = parser.parseStats("{\"num_for_sale\":0,\"lowest_price\":null,\"blocked_from_sale\":false}");

        assertEquals(0, stats.getNumForSale().intValue());
        assertNull(stats.getLowestPrice());
    }

    @Test
    void shouldJoinTrackArtists() throws IOException {
        String body = "{\"tracklist\":[{\"position\":\"A1\",\"title\":\"In The Flesh?\",\"duration\":\"3:19\","
                + "\"artists\":[{\"name\":\"Roger Waters\"},{\"name\":\"David Gilmour\"}],"
                + "\"extraartists\":[{\"name\":\"Bob Ezrin\"}]},{\"position\":\"A2\",\"title\":\"The Thin Ice\"}]}";

        List<CatalogTrack> tracks = parser.parseTracklist(body);

        assertEquals(2, tracks.size());
        assertEquals("Roger Waters, David Gilmour", tracks.get(0).getArtists());
        assertEquals("Bob Ezrin", tracks.get(0).getExtraArtists());
        assertNull(tracks.get(1).getArtists());
        assertEquals("", tracks.get(1).getDuration());
    }

    @Test
    void shouldRejectUnreadableJson() {
        assertThrows(IOException.class, () -> parser.parseTracklist("{not json"));
    }
}
