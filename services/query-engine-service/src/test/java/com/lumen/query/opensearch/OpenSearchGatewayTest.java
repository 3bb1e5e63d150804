package com.lumen.query.opensearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.query.backend.BackendHit;
import com.lumen.query.backend.BackendRequestException;
import com.lumen.query.backend.BackendUnavailableException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class OpenSearchGatewayTest {

    private static final String HITS = "{\"hits\":{\"hits\":["
        + "{\"_id\":\"doc1\",\"_score\":0.91,\"_source\":{\"content\":\"neural networks\"}},"
        + "{\"_id\":\"doc2\",\"_score\":0.42,\"_source\":{}}"
        + "]}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private OpenSearchGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = new OpenSearchGateway(restTemplate, objectMapper, new OpenSearchProperties());
    }

    @Test
    void vectorQueryBuildsKnnBodyWithFilters() {
        server.expect(requestTo("http://localhost:9200/chunks_vec_read/_search"))
            .andExpect(method(POST))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                JsonNode knn = root.path("query").path("knn").path("embedding");

                assertThat(root.path("size").asInt()).isEqualTo(5);
                assertThat(knn.path("k").asInt()).isEqualTo(5);
                assertThat(knn.path("vector").size()).isEqualTo(3);
                JsonNode filters = knn.path("filter").path("bool").path("filter");
                assertThat(filters.toString()).contains("{\"term\":{\"lang\":\"en\"}}");
                assertThat(filters.toString()).contains("{\"terms\":{\"source\":[\"wiki\",\"docs\"]}}");
            })
            .andRespond(withSuccess(HITS, MediaType.APPLICATION_JSON));

        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("lang", "en");
        filters.put("source", List.of("wiki", "docs"));
        List<BackendHit> hits = gateway.query(new float[] {0.1f, 0.2f, 0.3f}, 5, filters);

        server.verify();
        assertThat(hits).extracting(BackendHit::getDocId).containsExactly("doc1", "doc2");
        assertThat(hits.get(0).getScore()).isEqualTo(0.91);
        assertThat(hits.get(0).getContentRef()).isEqualTo("neural networks");
        assertThat(hits.get(1).getContentRef()).isNull();
    }

    @Test
    void keywordQueryUsesMultiMatchOverConfiguredFields() {
        server.expect(requestTo("http://localhost:9200/chunks_read/_search"))
            .andExpect(method(POST))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                JsonNode multiMatch = root.path("query").path("multi_match");

                assertThat(root.path("track_total_hits").asBoolean()).isFalse();
                assertThat(multiMatch.path("query").asText()).isEqualTo("machine learning training");
                assertThat(multiMatch.path("operator").asText()).isEqualTo("or");
                assertThat(multiMatch.path("fields").toString()).isEqualTo("[\"content\",\"title^2\"]");
            })
            .andRespond(withSuccess(HITS, MediaType.APPLICATION_JSON));

        List<BackendHit> hits = gateway.query(List.of("machine", "learning", "training"), 20);

        server.verify();
        assertThat(hits).hasSize(2);
    }

    @Test
    void emptyTermsSkipTheRequest() {
        assertThat(gateway.query(List.of(), 10)).isEmpty();
        server.verify();
    }

    @Test
    void serviceUnavailableIsTransient() {
        server.expect(requestTo("http://localhost:9200/chunks_read/_search"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> gateway.query(List.of("search"), 10))
            .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void badRequestIsPermanent() {
        server.expect(requestTo("http://localhost:9200/chunks_vec_read/_search"))
            .andRespond(withBadRequest());

        assertThatThrownBy(() -> gateway.query(new float[] {1.0f}, 10, Map.of()))
            .isInstanceOf(BackendRequestException.class);
    }

    @Test
    void nestedFilterValuesAreRejected() {
        assertThatThrownBy(() -> gateway.query(new float[] {1.0f}, 10, Map.of("meta", Map.of("a", 1))))
            .isInstanceOf(BackendRequestException.class);
    }
}
