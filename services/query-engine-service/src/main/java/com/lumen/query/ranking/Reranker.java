package com.lumen.query.ranking;

import com.lumen.query.api.InvalidQueryException;
import com.lumen.query.metrics.QueryMetrics;
import com.lumen.query.retrieval.SearchCandidate;
import com.lumen.query.text.Tokenizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Reranker {
    private static final Logger log = LoggerFactory.getLogger(Reranker.class);

    private final PairwiseRelevanceModel model;
    private final ExecutorService rerankExecutor;
    private final RankingProperties properties;
    private final QueryMetrics metrics;

    public Reranker(
        PairwiseRelevanceModel model,
        ExecutorService rerankExecutor,
        RankingProperties properties,
        QueryMetrics metrics
    ) {
        this.model = model;
        this.rerankExecutor = rerankExecutor;
        this.properties = properties;
        this.metrics = metrics;
    }

    // candidates past topK keep fusion order, final scores capped at the lowest rescored score
    public List<SearchCandidate> rerank(String query, List<SearchCandidate> candidates, int topK) {
        long started = System.nanoTime();
        if (!properties.isEnabled() || topK <= 0 || candidates == null || candidates.isEmpty()
            || query == null || query.isBlank()) {
            metrics.recordRerank(QueryMetrics.OUTCOME_SKIPPED, Duration.ofNanos(System.nanoTime() - started));
            return candidates == null ? List.of() : candidates;
        }
        int n = Math.min(topK, candidates.size());
        List<SearchCandidate> head = candidates.subList(0, n);
        List<String> passages = new ArrayList<>(n);
        for (SearchCandidate candidate : head) {
            passages.add(candidate.getContentRef() == null ? "" : candidate.getContentRef());
        }

        double[] scores;
        Future<double[]> future = rerankExecutor.submit(() -> scoreInBatches(query, passages));
        try {
            scores = future.get(properties.getTimeoutMs(), TimeUnit.MILLISECONDS);
            validate(scores, n);
        } catch (TimeoutException e) {
            future.cancel(true);
            return fallback("timeout", e, candidates, started);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return fallback("interrupted", e, candidates, started);
        } catch (ExecutionException e) {
            return fallback("model_error", e.getCause() == null ? e : e.getCause(), candidates, started);
        } catch (RankingUnavailableException e) {
            return fallback("malformed_scores", e, candidates, started);
        }

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        final double[] headScores = scores;
        order.sort(Comparator.<Integer>comparingDouble(i -> headScores[i]).reversed()
            .thenComparingInt(i -> i));

        List<SearchCandidate> reranked = new ArrayList<>(candidates.size());
        for (int position = 0; position < n; position++) {
            int index = order.get(position);
            double score = headScores[index];
            reranked.add(head.get(index).withRerankScore(score).withRanking(score, position + 1));
        }
        double floor = headScores[order.get(n - 1)];
        for (int i = n; i < candidates.size(); i++) {
            SearchCandidate candidate = candidates.get(i);
            double previous = candidate.getFinalScore() == null ? floor : candidate.getFinalScore();
            reranked.add(candidate.withRanking(Math.min(previous, floor), i + 1));
        }
        metrics.recordRerank(QueryMetrics.OUTCOME_SUCCESS, Duration.ofNanos(System.nanoTime() - started));
        log.debug("rerank_applied candidates={} rescored={}", candidates.size(), n);
        return reranked;
    }

    public List<SearchCandidate> diversify(List<SearchCandidate> candidates, Double lambda) {
        if (lambda == null || candidates == null || candidates.size() < 2) {
            return candidates == null ? List.of() : candidates;
        }
        if (lambda.isNaN() || lambda < 0.0 || lambda > 1.0) {
            throw new InvalidQueryException("diversity lambda must be within [0, 1], got " + lambda);
        }
        int n = candidates.size();
        double[] relevance = normalizedRelevance(candidates);
        double[][] similarity = similarityMatrix(candidates);

        boolean[] used = new boolean[n];
        double[] maxSimilarity = new double[n];
        List<SearchCandidate> selected = new ArrayList<>(n);
        for (int pick = 0; pick < n; pick++) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < n; i++) {
                if (used[i]) {
                    continue;
                }
                double score = lambda * relevance[i] - (1.0 - lambda) * maxSimilarity[i];
                if (score > bestScore) {
                    bestScore = score;
                    best = i;
                }
            }
            used[best] = true;
            selected.add(candidates.get(best).withRanking(bestScore, pick + 1));
            for (int i = 0; i < n; i++) {
                if (!used[i]) {
                    maxSimilarity[i] = Math.max(maxSimilarity[i], similarity[i][best]);
                }
            }
        }
        return selected;
    }

    public List<SearchCandidate> filterNearDuplicates(List<SearchCandidate> candidates, double threshold) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<Map<String, Integer>> keptVectors = new ArrayList<>();
        List<SearchCandidate> kept = new ArrayList<>();
        for (SearchCandidate candidate : candidates) {
            Map<String, Integer> vector = Tokenizer.termFrequencies(candidate.getContentRef());
            boolean duplicate = false;
            for (Map<String, Integer> existing : keptVectors) {
                if (Tokenizer.cosine(vector, existing) > threshold) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                keptVectors.add(vector);
                kept.add(candidate.withRank(kept.size() + 1));
            }
        }
        return kept;
    }

    private double[] scoreInBatches(String query, List<String> passages) {
        int batchSize = Math.max(1, properties.getBatchSize());
        double[] scores = new double[passages.size()];
        for (int start = 0; start < passages.size(); start += batchSize) {
            int end = Math.min(passages.size(), start + batchSize);
            double[] batch = model.score(query, passages.subList(start, end));
            if (batch == null || batch.length != end - start) {
                throw new RankingUnavailableException("model returned "
                    + (batch == null ? "no" : batch.length) + " scores for " + (end - start) + " passages");
            }
            System.arraycopy(batch, 0, scores, start, batch.length);
        }
        return scores;
    }

    private void validate(double[] scores, int expected) {
        if (scores == null || scores.length != expected) {
            throw new RankingUnavailableException("score count mismatch");
        }
        for (double score : scores) {
            if (Double.isNaN(score) || Double.isInfinite(score)) {
                throw new RankingUnavailableException("non-finite score");
            }
        }
    }

    private List<SearchCandidate> fallback(String reason, Throwable error, List<SearchCandidate> candidates, long started) {
        metrics.recordRerank(QueryMetrics.OUTCOME_ERROR, Duration.ofNanos(System.nanoTime() - started));
        log.warn("rerank_fallback reason={} candidates={} error={}", reason, candidates.size(), error.toString());
        return candidates;
    }

    private static double[] normalizedRelevance(List<SearchCandidate> candidates) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (SearchCandidate candidate : candidates) {
            double score = candidate.getFinalScore() == null ? 0.0 : candidate.getFinalScore();
            min = Math.min(min, score);
            max = Math.max(max, score);
        }
        double spread = max - min;
        double[] relevance = new double[candidates.size()];
        for (int i = 0; i < relevance.length; i++) {
            double score = candidates.get(i).getFinalScore() == null ? 0.0 : candidates.get(i).getFinalScore();
            relevance[i] = spread <= 0.0 ? 1.0 : (score - min) / spread;
        }
        return relevance;
    }

    private static double[][] similarityMatrix(List<SearchCandidate> candidates) {
        int n = candidates.size();
        List<Map<String, Integer>> vectors = new ArrayList<>(n);
        for (SearchCandidate candidate : candidates) {
            vectors.add(Tokenizer.termFrequencies(candidate.getContentRef()));
        }
        double[][] similarity = new double[n][n];
        for (int i = 0; i < n; i++) {
            similarity[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double value = Tokenizer.cosine(vectors.get(i), vectors.get(j));
                similarity[i][j] = value;
                similarity[j][i] = value;
            }
        }
        return similarity;
    }
}
