package com.lumen.query.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.lumen.query.backend.BackendHit;
import com.lumen.query.retrieval.SearchCandidate;
import java.util.List;
import org.junit.jupiter.api.Test;

class WeightedFusionTest {

    @Test
    void combinesNormalizedScores() {
        WeightedFusion fusion = new WeightedFusion(0.7);

        List<SearchCandidate> fused = fusion.fuse(
            List.of(new BackendHit("d1", 0.9, "a"), new BackendHit("d2", 0.5, "b")),
            List.of(new BackendHit("d2", 10.0, "b"), new BackendHit("d3", 2.0, "c")),
            60
        );

        assertThat(fused).extracting(SearchCandidate::getDocId).containsExactly("d1", "d2", "d3");
        assertThat(fused.get(0).getFusedScore()).isCloseTo(0.7, within(1e-9));
        assertThat(fused.get(1).getFusedScore()).isCloseTo(0.3, within(1e-9));
        assertThat(fused.get(2).getFusedScore()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void singleDistinctScoreCountsAsFullyRelevant() {
        WeightedFusion fusion = new WeightedFusion(0.4);

        List<SearchCandidate> fused = fusion.fuse(List.of(new BackendHit("only", 0.12, "x")), List.of(), 60);

        assertThat(fused.get(0).getFusedScore()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void alphaOneIgnoresKeywordScores() {
        WeightedFusion fusion = new WeightedFusion(1.0);

        List<SearchCandidate> fused = fusion.fuse(
            List.of(new BackendHit("v1", 0.3, "a"), new BackendHit("v2", 0.2, "b")),
            List.of(new BackendHit("v2", 9.0, "b")),
            60
        );

        assertThat(fused).extracting(SearchCandidate::getDocId).containsExactly("v1", "v2");
    }

    @Test
    void rejectsAlphaOutsideUnitInterval() {
        assertThatThrownBy(() -> new WeightedFusion(1.2)).isInstanceOf(IllegalArgumentException.class);
    }
}
