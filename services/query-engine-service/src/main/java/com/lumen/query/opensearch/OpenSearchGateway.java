package com.lumen.query.opensearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.query.backend.BackendHit;
import com.lumen.query.backend.BackendRequestException;
import com.lumen.query.backend.BackendUnavailableException;
import com.lumen.query.backend.KeywordBackend;
import com.lumen.query.backend.VectorBackend;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

public class OpenSearchGateway implements VectorBackend, KeywordBackend {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;

    public OpenSearchGateway(RestTemplate restTemplate, ObjectMapper objectMapper, OpenSearchProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public List<BackendHit> query(float[] embedding, int topK, Map<String, Object> filters) {
        if (embedding == null || embedding.length == 0) {
            throw new BackendRequestException("Vector query requires a non-empty embedding");
        }
        List<Float> vector = new ArrayList<>(embedding.length);
        for (float value : embedding) {
            vector.add(value);
        }

        Map<String, Object> field = new LinkedHashMap<>();
        field.put("vector", vector);
        field.put("k", topK);
        List<Map<String, Object>> filterClauses = buildFilters(filters);
        if (!filterClauses.isEmpty()) {
            field.put("filter", Map.of("bool", Map.of("filter", filterClauses)));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", topK);
        body.put("_source", List.of(properties.getContentField()));
        body.put("query", Map.of("knn", Map.of(properties.getVectorField(), field)));

        return extractHits(postJson("/" + properties.getVectorIndex() + "/_search", body));
    }

    @Override
    public List<BackendHit> query(List<String> terms, int topK) {
        if (terms == null || terms.isEmpty()) {
            return List.of();
        }
        Map<String, Object> multiMatch = new LinkedHashMap<>();
        multiMatch.put("query", String.join(" ", terms));
        multiMatch.put("fields", properties.getKeywordFields());
        multiMatch.put("operator", "or");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", topK);
        body.put("track_total_hits", false);
        body.put("_source", List.of(properties.getContentField()));
        body.put("query", Map.of("multi_match", multiMatch));

        return extractHits(postJson("/" + properties.getChunkIndex() + "/_search", body));
    }

    private List<Map<String, Object>> buildFilters(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> clauses = new ArrayList<>(filters.size());
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            Object value = entry.getValue();
            if (entry.getKey() == null || entry.getKey().isBlank() || value == null || value instanceof Map) {
                throw new BackendRequestException("Unsupported filter: " + entry.getKey());
            }
            if (value instanceof Collection) {
                clauses.add(Map.of("terms", Map.of(entry.getKey(), value)));
            } else {
                clauses.add(Map.of("term", Map.of(entry.getKey(), value)));
            }
        }
        return clauses;
    }

    private JsonNode postJson(String path, Object body) {
        String url = buildUrl(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            String payload = objectMapper.writeValueAsString(body);
            ResponseEntity<String> response = restTemplate.exchange(
                url,
                HttpMethod.POST,
                new HttpEntity<>(payload, headers),
                String.class
            );
            String responseBody = response.getBody();
            if (responseBody == null || responseBody.isBlank()) {
                throw new BackendRequestException("Empty OpenSearch response: " + url);
            }
            return objectMapper.readTree(responseBody);
        } catch (ResourceAccessException e) {
            throw new BackendUnavailableException("OpenSearch unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 429 || status == 502 || status == 503 || status == 504) {
                throw new BackendUnavailableException("OpenSearch unavailable: " + status, e);
            }
            throw new BackendRequestException("OpenSearch error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new BackendRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private List<BackendHit> extractHits(JsonNode response) {
        List<BackendHit> hits = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            String docId = hit.path("_id").asText(null);
            if (docId == null || docId.isEmpty()) {
                continue;
            }
            String content = hit.path("_source").path(properties.getContentField()).asText(null);
            hits.add(new BackendHit(docId, hit.path("_score").asDouble(0.0), content));
        }
        return hits;
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
