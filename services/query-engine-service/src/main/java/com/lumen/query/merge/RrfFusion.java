package com.lumen.query.merge;

import com.lumen.query.backend.BackendHit;
import com.lumen.query.retrieval.FusionStrategy;
import com.lumen.query.retrieval.SearchCandidate;
import java.util.List;

public class RrfFusion implements FusionStrategy {
    public static final int DEFAULT_K = 60;

    @Override
    public List<SearchCandidate> fuse(List<BackendHit> vectorResults, List<BackendHit> keywordResults, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        CandidateAccumulator accumulator = new CandidateAccumulator();
        accumulator.addVector(vectorResults);
        accumulator.addKeyword(keywordResults);

        List<CandidateAccumulator.MutableCandidate> candidates = accumulator.candidates();
        for (CandidateAccumulator.MutableCandidate candidate : candidates) {
            double score = 0.0;
            if (candidate.getVectorRank() != null) {
                score += 1.0 / (k + candidate.getVectorRank());
            }
            if (candidate.getKeywordRank() != null) {
                score += 1.0 / (k + candidate.getKeywordRank());
            }
            candidate.setScore(score);
        }
        return CandidateAccumulator.rank(candidates);
    }
}
