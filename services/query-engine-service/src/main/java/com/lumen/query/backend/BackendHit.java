package com.lumen.query.backend;

import java.util.Objects;

public final class BackendHit {
    private final String docId;
    private final double score;
    private final String contentRef;

    public BackendHit(String docId, double score, String contentRef) {
        this.docId = Objects.requireNonNull(docId, "docId");
        this.score = score;
        this.contentRef = contentRef;
    }

    public String getDocId() {
        return docId;
    }

    public double getScore() {
        return score;
    }

    public String getContentRef() {
        return contentRef;
    }

    @Override
    public String toString() {
        return "BackendHit{docId=" + docId + ", score=" + score + "}";
    }
}
