package me.golemcore.recall.retrieval;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class KeywordScoringTest {

    @Test
    void shouldQuoteAndJoinTokens() {
        assertEquals("\"deploy\" AND \"staging_v2\" AND \"2026\"",
                KeywordScoring.buildFtsQuery("deploy \"staging_v2\", 2026!"));
    }

    @Test
    void shouldReturnNullWithoutTokens() {
        assertNull(KeywordScoring.buildFtsQuery("?!  --"));
        assertNull(KeywordScoring.buildFtsQuery(""));
        assertNull(KeywordScoring.buildFtsQuery(null));
    }

    @Test
    void shouldMapRankToScore() {
        assertEquals(1.0, KeywordScoring.bm25RankToScore(0.0));
        assertEquals(0.5, KeywordScoring.bm25RankToScore(1.0));
        assertEquals(1.0, KeywordScoring.bm25RankToScore(-3.0));
        assertEquals(1.0 / 1000.0, KeywordScoring.bm25RankToScore(Double.NaN));
        assertEquals(1.0 / 1000.0, KeywordScoring.bm25RankToScore(Double.POSITIVE_INFINITY));
    }
}
