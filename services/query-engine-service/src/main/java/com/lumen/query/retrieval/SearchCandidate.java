package com.lumen.query.retrieval;

import java.util.Objects;

public final class SearchCandidate {
    private final String docId;
    private final String contentRef;
    private final Double vectorScore;
    private final Double keywordScore;
    private final Integer vectorRank;
    private final Integer keywordRank;
    private final Double fusedScore;
    private final Double rerankScore;
    private final Double finalScore;
    private final Integer rank;

    private SearchCandidate(
        String docId,
        String contentRef,
        Double vectorScore,
        Double keywordScore,
        Integer vectorRank,
        Integer keywordRank,
        Double fusedScore,
        Double rerankScore,
        Double finalScore,
        Integer rank
    ) {
        this.docId = Objects.requireNonNull(docId, "docId");
        this.contentRef = contentRef;
        this.vectorScore = vectorScore;
        this.keywordScore = keywordScore;
        this.vectorRank = vectorRank;
        this.keywordRank = keywordRank;
        this.fusedScore = fusedScore;
        this.rerankScore = rerankScore;
        this.finalScore = finalScore;
        this.rank = rank;
    }

    public static SearchCandidate fused(
        String docId,
        String contentRef,
        Double vectorScore,
        Double keywordScore,
        Integer vectorRank,
        Integer keywordRank,
        double fusedScore,
        int rank
    ) {
        return new SearchCandidate(
            docId, contentRef, vectorScore, keywordScore, vectorRank, keywordRank,
            fusedScore, null, fusedScore, rank
        );
    }

    public SearchCandidate withRerankScore(double score) {
        return new SearchCandidate(
            docId, contentRef, vectorScore, keywordScore, vectorRank, keywordRank,
            fusedScore, score, finalScore, rank
        );
    }

    public SearchCandidate withRanking(double newFinalScore, int newRank) {
        return new SearchCandidate(
            docId, contentRef, vectorScore, keywordScore, vectorRank, keywordRank,
            fusedScore, rerankScore, newFinalScore, newRank
        );
    }

    public SearchCandidate withRank(int newRank) {
        return new SearchCandidate(
            docId, contentRef, vectorScore, keywordScore, vectorRank, keywordRank,
            fusedScore, rerankScore, finalScore, newRank
        );
    }

    public String getDocId() {
        return docId;
    }

    public String getContentRef() {
        return contentRef;
    }

    public Double getVectorScore() {
        return vectorScore;
    }

    public Double getKeywordScore() {
        return keywordScore;
    }

    public Integer getVectorRank() {
        return vectorRank;
    }

    public Integer getKeywordRank() {
        return keywordRank;
    }

    public Double getFusedScore() {
        return fusedScore;
    }

    public Double getRerankScore() {
        return rerankScore;
    }

    public Double getFinalScore() {
        return finalScore;
    }

    public Integer getRank() {
        return rank;
    }

    @Override
    public String toString() {
        return "SearchCandidate{docId=" + docId + ", rank=" + rank + ", finalScore=" + finalScore + "}";
    }
}
