package com.lumen.query.merge;

import com.lumen.query.backend.BackendHit;
import com.lumen.query.retrieval.FusionStrategy;
import com.lumen.query.retrieval.SearchCandidate;
import java.util.List;

public class WeightedFusion implements FusionStrategy {
    private final double alpha;

    public WeightedFusion(double alpha) {
        if (alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be within [0, 1]");
        }
        this.alpha = alpha;
    }

    @Override
    public List<SearchCandidate> fuse(List<BackendHit> vectorResults, List<BackendHit> keywordResults, int k) {
        CandidateAccumulator accumulator = new CandidateAccumulator();
        accumulator.addVector(vectorResults);
        accumulator.addKeyword(keywordResults);
        List<CandidateAccumulator.MutableCandidate> candidates = accumulator.candidates();

        double[] vectorRange = range(candidates, true);
        double[] keywordRange = range(candidates, false);
        for (CandidateAccumulator.MutableCandidate candidate : candidates) {
            double vector = normalize(candidate.getVectorScore(), vectorRange);
            double keyword = normalize(candidate.getKeywordScore(), keywordRange);
            candidate.setScore(alpha * vector + (1.0 - alpha) * keyword);
        }
        return CandidateAccumulator.rank(candidates);
    }

    public double getAlpha() {
        return alpha;
    }

    private static double[] range(List<CandidateAccumulator.MutableCandidate> candidates, boolean vector) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (CandidateAccumulator.MutableCandidate candidate : candidates) {
            Double score = vector ? candidate.getVectorScore() : candidate.getKeywordScore();
            if (score != null) {
                min = Math.min(min, score);
                max = Math.max(max, score);
            }
        }
        return new double[] {min, max};
    }

    private static double normalize(Double score, double[] range) {
        if (score == null) {
            return 0.0;
        }
        double spread = range[1] - range[0];
        // a single distinct score counts as fully relevant
        return spread <= 0.0 ? 1.0 : (score - range[0]) / spread;
    }
}
