package com.lumen.query.merge;

import com.lumen.query.backend.BackendHit;
import com.lumen.query.retrieval.SearchCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class CandidateAccumulator {
    static final Comparator<MutableCandidate> ORDER = Comparator
        .comparingDouble(MutableCandidate::getScore).reversed()
        .thenComparing(MutableCandidate::getVectorScore, Comparator.nullsLast(Comparator.<Double>reverseOrder()))
        .thenComparing(MutableCandidate::getDocId);

    private final Map<String, MutableCandidate> candidates = new HashMap<>();

    void addVector(List<BackendHit> hits) {
        int rank = 0;
        for (BackendHit hit : safe(hits)) {
            rank++;
            MutableCandidate candidate = candidates.computeIfAbsent(hit.getDocId(), MutableCandidate::new);
            if (candidate.vectorRank != null) {
                // keep the first (best) rank of a duplicate
                continue;
            }
            candidate.vectorRank = rank;
            candidate.vectorScore = hit.getScore();
            candidate.adoptContent(hit.getContentRef());
        }
    }

    void addKeyword(List<BackendHit> hits) {
        int rank = 0;
        for (BackendHit hit : safe(hits)) {
            rank++;
            MutableCandidate candidate = candidates.computeIfAbsent(hit.getDocId(), MutableCandidate::new);
            if (candidate.keywordRank != null) {
                continue;
            }
            candidate.keywordRank = rank;
            candidate.keywordScore = hit.getScore();
            candidate.adoptContent(hit.getContentRef());
        }
    }

    List<MutableCandidate> candidates() {
        return new ArrayList<>(candidates.values());
    }

    static List<SearchCandidate> rank(List<MutableCandidate> scored) {
        scored.sort(ORDER);
        List<SearchCandidate> fused = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            MutableCandidate candidate = scored.get(i);
            fused.add(SearchCandidate.fused(
                candidate.docId,
                candidate.contentRef,
                candidate.vectorScore,
                candidate.keywordScore,
                candidate.vectorRank,
                candidate.keywordRank,
                candidate.score,
                i + 1
            ));
        }
        return fused;
    }

    private static List<BackendHit> safe(List<BackendHit> hits) {
        return hits == null ? List.of() : hits;
    }

    static final class MutableCandidate {
        private final String docId;
        private String contentRef;
        private Integer vectorRank;
        private Integer keywordRank;
        private Double vectorScore;
        private Double keywordScore;
        private double score;

        private MutableCandidate(String docId) {
            this.docId = docId;
        }

        private void adoptContent(String content) {
            if (contentRef == null && content != null) {
                contentRef = content;
            }
        }

        String getDocId() {
            return docId;
        }

        double getScore() {
            return score;
        }

        void setScore(double score) {
            this.score = score;
        }

        Double getVectorScore() {
            return vectorScore;
        }

        Double getKeywordScore() {
            return keywordScore;
        }

        Integer getVectorRank() {
            return vectorRank;
        }

        Integer getKeywordRank() {
            return keywordRank;
        }
    }
}
