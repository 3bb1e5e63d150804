package com.lumen.query.ranking;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

// the cross-encoder returns raw logits; scores are squashed into [0, 1] with a sigmoid
public class RankingGateway implements PairwiseRelevanceModel {
    private final RestTemplate restTemplate;
    private final RankingProperties properties;

    public RankingGateway(RestTemplate restTemplate, RankingProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public double[] score(String query, List<String> passages) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new RankingUnavailableException("Ranking base url missing");
        }
        CrossEncodeRequest request = new CrossEncodeRequest();
        request.setModel(properties.getModel());
        request.setQuery(query);
        request.setPassages(passages);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        CrossEncodeResponse body;
        try {
            ResponseEntity<CrossEncodeResponse> response = restTemplate.exchange(
                buildUrl("/v1/cross-encode"),
                HttpMethod.POST,
                new HttpEntity<>(request, headers),
                CrossEncodeResponse.class
            );
            body = response.getBody();
        } catch (ResourceAccessException e) {
            throw new RankingUnavailableException("Ranking service unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new RankingUnavailableException("Ranking service error: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new RankingUnavailableException("Ranking service returned an unreadable body", e);
        }
        if (body == null || body.getScores() == null || body.getScores().size() != passages.size()) {
            throw new RankingUnavailableException("Ranking service returned a malformed score list");
        }
        double[] scores = new double[passages.size()];
        for (int i = 0; i < scores.length; i++) {
            Double logit = body.getScores().get(i);
            if (logit == null || logit.isNaN()) {
                throw new RankingUnavailableException("Ranking service returned a non-numeric score");
            }
            scores[i] = sigmoid(logit);
        }
        return scores;
    }

    static double sigmoid(double logit) {
        return 1.0 / (1.0 + Math.exp(-logit));
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CrossEncodeRequest {
        private String model;
        private String query;
        private List<String> passages;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public List<String> getPassages() {
            return passages;
        }

        public void setPassages(List<String> passages) {
            this.passages = passages;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CrossEncodeResponse {
        private List<Double> scores;

        public List<Double> getScores() {
            return scores;
        }

        public void setScores(List<Double> scores) {
            this.scores = scores;
        }
    }
}
