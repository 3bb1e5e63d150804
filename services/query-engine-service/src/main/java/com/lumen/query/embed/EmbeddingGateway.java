package com.lumen.query.embed;

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

public class EmbeddingGateway implements EmbeddingProvider {
    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(RestTemplate restTemplate, EmbeddingProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingRequestException("embed_empty_text");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingRequestException("embed_base_url_missing");
        }
        EmbeddingRequest request = new EmbeddingRequest();
        request.setModel(properties.getModel());
        request.setTexts(List.of(text));
        request.setNormalize(true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        EmbeddingResponse body;
        try {
            ResponseEntity<EmbeddingResponse> response = restTemplate.exchange(
                buildUrl("/v1/embed"),
                HttpMethod.POST,
                new HttpEntity<>(request, headers),
                EmbeddingResponse.class
            );
            body = response.getBody();
        } catch (ResourceAccessException e) {
            String reason = e.getCause() instanceof java.net.SocketTimeoutException ? "embed_timeout" : "embed_unavailable";
            throw new EmbeddingUnavailableException(reason, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (e.getStatusCode().is4xxClientError() && status != 429) {
                throw new EmbeddingRequestException("embed_http_" + status, e);
            }
            throw new EmbeddingUnavailableException("embed_http_" + status, e);
        } catch (RestClientException e) {
            throw new EmbeddingRequestException("embed_bad_response", e);
        }
        if (body == null || body.getVectors() == null || body.getVectors().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> values = body.getVectors().get(0);
        if (values == null || values.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = values.get(i);
            vector[i] = value == null ? 0.0f : value.floatValue();
        }
        return vector;
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) + path : base + path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingRequest {
        private String model;
        private List<String> texts;
        private Boolean normalize;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getTexts() {
            return texts;
        }

        public void setTexts(List<String> texts) {
            this.texts = texts;
        }

        public Boolean getNormalize() {
            return normalize;
        }

        public void setNormalize(Boolean normalize) {
            this.normalize = normalize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        private List<List<Double>> vectors;

        public List<List<Double>> getVectors() {
            return vectors;
        }

        public void setVectors(List<List<Double>> vectors) {
            this.vectors = vectors;
        }
    }
}
