package com.example.musiccollection.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class MatchKeysTest {

    @Test
    void shouldStripPunctuationCaseAndLeadingArticle() {
        assertEquals("beatles - abbey road", MatchKeys.matchKey("The Beatles", "Abbey Road!"));
        assertEquals("pink floyd - wall", MatchKeys.matchKey("Pink Floyd", "The Wall"));
    }

    @Test
    void shouldStripRepeatedLeadingArticles() {
        assertEquals("band", MatchKeys.normalize("the the band"));
        assertEquals("band", MatchKeys.normalize(MatchKeys.normalize("The The Band")));
        assertEquals("the", MatchKeys.normalize("The The"));
    }

    @Test
    void shouldCollapseWhitespace() {
        assertEquals("miles davis", MatchKeys.normalize("  Miles \t  Davis  "));
    }

    @Test
    void shouldReturnEmptyForNullOrBlank() {
        assertEquals("", MatchKeys.normalize(null));
        assertEquals("", MatchKeys.normalize(""));
        assertEquals(" - ", MatchKeys.matchKey(null, null));
    }

    @Test
    void shouldBeIdempotent() {
        String[] samples = {"The The", "the the the end", "AC/DC", "Sigur Rós", "  The  Who  ", "théâtre"};
        for (String sample : samples) {
            String once = MatchKeys.normalize(sample);
            assertEquals(once, MatchKeys.normalize(once), sample);
        }
    }

    @Test
    void shouldTruncateLongKeys() {
        StringBuilder title = new StringBuilder();
        for (int i = 0; i < 600; i++) {
            title.append('a');
        }
        assertEquals(MatchKeys.MATCH_KEY_MAX_LENGTH, MatchKeys.matchKey("x", title.toString()).length());
    }
}
