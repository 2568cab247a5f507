package com.psl.search.opensearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class OpenSearchGatewayTest {

    private MockRestServiceServer server;
    private OpenSearchGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchProperties properties = new OpenSearchProperties();
        properties.setBaseUrl("http://localhost:9200/");
        properties.setIndex("papers_read");
        gateway = new OpenSearchGateway(restTemplate, new ObjectMapper(), properties);
    }

    @Test
    void searchPostsToReadAlias() {
        server.expect(requestTo("http://localhost:9200/papers_read/_search"))
            .andExpect(method(POST))
            .andExpect(content().json("{\"size\":1}"))
            .andRespond(withSuccess("{\"hits\":{\"hits\":[]}}", MediaType.APPLICATION_JSON));

        JsonNode response = gateway.search(Map.of("size", 1));

        assertThat(response.path("hits").path("hits").isArray()).isTrue();
        server.verify();
    }

    @Test
    void gatewayTimeoutIsUnavailable() {
        server.expect(requestTo("http://localhost:9200/papers_read/_search"))
            .andRespond(withStatus(HttpStatus.GATEWAY_TIMEOUT));

        assertThatThrownBy(() -> gateway.search(Map.of())).isInstanceOf(OpenSearchUnavailableException.class);
    }

    @Test
    void rejectedQueryIsARequestError() {
        server.expect(requestTo("http://localhost:9200/papers_read/_search"))
            .andRespond(withBadRequest());

        assertThatThrownBy(() -> gateway.search(Map.of()))
            .isInstanceOf(OpenSearchRequestException.class)
            .hasMessageContaining("400");
    }
}
