package com.lumen.query.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.lumen.query.resilience.FailureClassifier;
import com.lumen.query.resilience.FailureKind;
import com.lumen.query.resilience.PermanentFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingGatewayTest {

    private MockRestServiceServer server;
    private EmbeddingGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setBaseUrl("http://embed.local/");
        properties.setModel("e5-small");
        gateway = new EmbeddingGateway(restTemplate, properties);
    }

    @Test
    void postsTextAndReadsFirstVector() {
        server.expect(requestTo("http://embed.local/v1/embed"))
            .andExpect(method(POST))
            .andExpect(content().json("{\"model\":\"e5-small\",\"texts\":[\"machine learning\"],\"normalize\":true}"))
            .andRespond(withSuccess("{\"vectors\":[[0.25,-0.5,1.0]]}", MediaType.APPLICATION_JSON));

        float[] vector = gateway.embed("machine learning");

        server.verify();
        assertThat(vector).containsExactly(0.25f, -0.5f, 1.0f);
    }

    @Test
    void emptyVectorListIsUnavailable() {
        server.expect(requestTo("http://embed.local/v1/embed"))
            .andRespond(withSuccess("{\"vectors\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("query"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_empty_response");
    }

    @Test
    void serverErrorCarriesStatus() {
        server.expect(requestTo("http://embed.local/v1/embed")).andRespond(withServerError());

        assertThatThrownBy(() -> gateway.embed("query"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_500");
    }

    @Test
    void badRequestIsPermanent() {
        server.expect(requestTo("http://embed.local/v1/embed")).andRespond(withBadRequest());

        assertThatThrownBy(() -> gateway.embed("query"))
            .isInstanceOf(EmbeddingRequestException.class)
            .isInstanceOf(PermanentFailure.class)
            .hasMessage("embed_http_400")
            .satisfies(e -> assertThat(new FailureClassifier().classify(e)).isEqualTo(FailureKind.PERMANENT));
    }

    @Test
    void throttlingStaysTransient() {
        server.expect(requestTo("http://embed.local/v1/embed")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> gateway.embed("query"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_429");
    }

    @Test
    void unparseableBodyIsPermanent() {
        server.expect(requestTo("http://embed.local/v1/embed"))
            .andRespond(withSuccess("not json", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("query"))
            .isInstanceOf(EmbeddingRequestException.class)
            .hasMessage("embed_bad_response");
    }
}
