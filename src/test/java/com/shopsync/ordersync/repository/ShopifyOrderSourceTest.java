package com.shopsync.ordersync.repository;

import com.shopsync.ordersync.dto.ShopifyOrdersResponse;
import com.shopsync.ordersync.model.Order;
import com.shopsync.ordersync.service.SyncException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.List;

import static com.shopsync.ordersync.OrderFixtures.order;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShopifyOrderSourceTest {

    private static final OffsetDateTime START = OffsetDateTime.parse("2024-05-01T00:00:00Z");
    private static final OffsetDateTime END = OffsetDateTime.parse("2024-05-10T23:59:59+05:00");
    private static final String NEXT_URL =
            "https://demo.myshopify.com/admin/api/2024-01/orders.json?limit=250&page_info=eyJsYXN0X2lkIjo0fQ";

    @Mock
    private RestTemplate restTemplate;

    private ShopifyOrderSource source(int maxPages) {
        return new ShopifyOrderSource(restTemplate, "demo.myshopify.com", "shpat_test", "2024-01", 500, maxPages);
    }

    @Test
    void firstPageCarriesRangeInUtc() {
        URI uri = source(10).firstPage(START, END);

        assertThat(uri.getScheme()).isEqualTo("https");
        assertThat(uri.getHost()).isEqualTo("demo.myshopify.com");
        assertThat(uri.getPath()).isEqualTo("/admin/api/2024-01/orders.json");
        assertThat(uri.getQuery())
                .contains("status=any")
                .contains("limit=250")
                .contains("created_at_min=2024-05-01T00:00:00Z")
                .contains("created_at_max=2024-05-10T18:59:59Z");
    }

    @Test
    void readsNextLinkFromHeader() {
        String header = "<https://demo.myshopify.com/admin/api/2024-01/orders.json?page_info=prev>; rel=\"previous\", "
                + "<" + NEXT_URL + ">; rel=\"next\"";

        assertThat(ShopifyOrderSource.nextPage(header)).isEqualTo(URI.create(NEXT_URL));
        assertThat(ShopifyOrderSource.nextPage("<https://demo.myshopify.com/x>; rel=\"previous\"")).isNull();
        assertThat(ShopifyOrderSource.nextPage(null)).isNull();
    }

    @Test
    void followsPaginationUntilLastPage() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(ShopifyOrdersResponse.class)))
                .thenReturn(page(List.of(order(1, "", 1).build(), order(2, "", 1).build()), NEXT_URL))
                .thenReturn(page(List.of(order(3, "", 1).build()), null));

        List<Order> orders = source(10).fetchOrders(START, END);

        assertThat(orders).extracting(Order::getId).containsExactly(1L, 2L, 3L);
        ArgumentCaptor<URI> uris = ArgumentCaptor.forClass(URI.class);
        ArgumentCaptor<HttpEntity> entities = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate, times(2)).exchange(uris.capture(), eq(HttpMethod.GET), entities.capture(), eq(ShopifyOrdersResponse.class));
        assertThat(uris.getAllValues().get(1)).isEqualTo(URI.create(NEXT_URL));
        assertThat(entities.getValue().getHeaders().getFirst(ShopifyOrderSource.ACCESS_TOKEN_HEADER)).isEqualTo("shpat_test");
    }

    @Test
    void stopsAtPageCeiling() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(ShopifyOrdersResponse.class)))
                .thenReturn(page(List.of(order(1, "", 1).build()), NEXT_URL));

        List<Order> orders = source(2).fetchOrders(START, END);

        assertThat(orders).hasSize(2);
        verify(restTemplate, times(2)).exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(ShopifyOrdersResponse.class));
    }

    @Test
    void emptyBodyEndsWithNoOrders() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(ShopifyOrdersResponse.class)))
                .thenReturn(ResponseEntity.ok().build());

        assertThat(source(10).fetchOrders(START, END)).isEmpty();
    }

    @Test
    void unreachableShopAbortsTheFetch() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(ShopifyOrdersResponse.class)))
                .thenThrow(new ResourceAccessException("Connection refused"));

        assertThatThrownBy(() -> source(10).fetchOrders(START, END))
                .isInstanceOf(SyncException.class)
                .hasMessageContaining("page 1");
    }

    private static ResponseEntity<ShopifyOrdersResponse> page(List<Order> orders, String next) {
        ShopifyOrdersResponse body = new ShopifyOrdersResponse();
        body.setOrders(orders);
        HttpHeaders headers = new HttpHeaders();
        if (next != null) {
            headers.add(HttpHeaders.LINK, "<" + next + ">; rel=\"next\"");
        }
        return new ResponseEntity<>(body, headers, HttpStatus.OK);
    }
}
