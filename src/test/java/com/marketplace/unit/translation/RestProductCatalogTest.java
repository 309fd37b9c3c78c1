package com.marketplace.unit.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.marketplace.config.RealtimeConfig;
import com.marketplace.translation.RestProductCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RestProductCatalogTest {

    private static final String BASE_URL = "http://marketplace.test";

    private MockRestServiceServer server;
    private RestProductCatalog catalog;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        catalog = new RestProductCatalog(builder.build(), new RealtimeConfig());
    }

    @Test
    @DisplayName("returns the product title and caches it")
    void returnsAndCachesTitle() {
        server.expect(once(), requestTo(BASE_URL + "/api/marketplace/products/p1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(
                        "{\"product\":{\"id\":\"p1\",\"title\":\"Vintage Lamp\",\"price\":40}}",
                        MediaType.APPLICATION_JSON));

        assertThat(catalog.findTitle("p1")).contains("Vintage Lamp");
        assertThat(catalog.findTitle("p1")).contains("Vintage Lamp");
        server.verify();
    }

    @Test
    @DisplayName("caches unknown products as empty")
    void cachesNotFound() {
        server.expect(once(), requestTo(BASE_URL + "/api/marketplace/products/gone"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(catalog.findTitle("gone")).isEmpty();
        assertThat(catalog.findTitle("gone")).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("does not cache server errors")
    void serverErrorNotCached() {
        server.expect(once(), requestTo(BASE_URL + "/api/marketplace/products/p2"))
                .andRespond(withServerError());
        server.expect(once(), requestTo(BASE_URL + "/api/marketplace/products/p2"))
                .andRespond(withSuccess("{\"product\":{\"id\":\"p2\",\"title\":\"Desk\"}}", MediaType.APPLICATION_JSON));

        assertThat(catalog.findTitle("p2")).isEmpty();
        assertThat(catalog.findTitle("p2")).contains("Desk");
        server.verify();
    }

    @Test
    @DisplayName("blank titles count as unknown")
    void blankTitleIsEmpty() {
        server.expect(once(), requestTo(BASE_URL + "/api/marketplace/products/p3"))
                .andRespond(withSuccess("{\"product\":{\"id\":\"p3\",\"title\":\"  \"}}", MediaType.APPLICATION_JSON));

        assertThat(catalog.findTitle("p3")).isEmpty();
    }

    @Test
    @DisplayName("blank ids never hit the API")
    void blankIdSkipsApi() {
        assertThat(catalog.findTitle(" ")).isEmpty();
        assertThat(catalog.findTitle(null)).isEmpty();
        server.verify();
    }
}
