package com.psl.indexer.opensearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.indexer.config.OpenSearchProperties;
import java.util.List;
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
        gateway = new OpenSearchGateway(restTemplate, new ObjectMapper(), properties);
    }

    @Test
    void missingAliasHasNoTargets() {
        server.expect(requestTo("http://localhost:9200/_alias/papers"))
            .andExpect(method(GET))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(gateway.aliasTargets("papers")).isEmpty();
        server.verify();
    }

    @Test
    void aliasTargetsListsConcreteIndices() {
        server.expect(requestTo("http://localhost:9200/_alias/papers"))
            .andRespond(withSuccess("{\"papers-v2\":{\"aliases\":{\"papers\":{}}}}", MediaType.APPLICATION_JSON));

        assertThat(gateway.aliasTargets("papers")).containsExactly("papers-v2");
    }

    @Test
    void mappingMetaIsKeyedByIndex() {
        server.expect(requestTo("http://localhost:9200/papers/_mapping"))
            .andRespond(withSuccess(
                "{\"papers-v3\":{\"mappings\":{\"_meta\":{\"schema_version\":3},\"properties\":{}}}}",
                MediaType.APPLICATION_JSON
            ));

        assertThat(gateway.mappingMeta("papers").get("papers-v3").path("schema_version").asInt()).isEqualTo(3);
    }

    @Test
    void swapAliasRemovesPreviousAndAddsNewAtomically() {
        server.expect(requestTo("http://localhost:9200/_aliases"))
            .andExpect(method(POST))
            .andExpect(content().json(
                "{\"actions\":["
                    + "{\"remove\":{\"index\":\"papers-v2\",\"alias\":\"papers\"}},"
                    + "{\"add\":{\"index\":\"papers-v3\",\"alias\":\"papers\"}}]}"
            ))
            .andRespond(withSuccess("{\"acknowledged\":true}", MediaType.APPLICATION_JSON));

        gateway.swapAlias("papers", "papers-v3", List.of("papers-v2", "papers-v3"));
        server.verify();
    }

    @Test
    void gatewayErrorsMapToUnavailable() {
        server.expect(requestTo("http://localhost:9200/_bulk"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> gateway.bulk("{}\n"))
            .isInstanceOf(OpenSearchUnavailableException.class);
    }

    @Test
    void clientErrorsCarryStatus() {
        server.expect(requestTo("http://localhost:9200/papers-v3"))
            .andRespond(withBadRequest());

        assertThatThrownBy(() -> gateway.createIndex("papers-v3", Map.of()))
            .isInstanceOfSatisfying(OpenSearchRequestException.class,
                e -> assertThat(e.getStatusCode()).isEqualTo(400));
    }
}
