package com.shopsync.ordersync.repository;

import com.shopsync.ordersync.dto.ShopifyOrdersResponse;
import com.shopsync.ordersync.model.Order;
import com.shopsync.ordersync.service.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads orders from the Shopify Admin REST API, following cursor pagination through the
 * {@code Link} response header.
 */
@Repository
public class ShopifyOrderSource implements OrderSource {

    private static final Logger logger = LoggerFactory.getLogger(ShopifyOrderSource.class);

    static final String ACCESS_TOKEN_HEADER = "X-Shopify-Access-Token";
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?next\"?");

    private final RestTemplate restTemplate;
    private final String shopDomain;
    private final String accessToken;
    private final String apiVersion;
    private final int pageSize;
    private final int maxPages;

    public ShopifyOrderSource(@Qualifier("shopifyRestTemplate") RestTemplate restTemplate,
                              @Value("${shopify.shop-domain}") String shopDomain,
                              @Value("${shopify.access-token}") String accessToken,
                              @Value("${shopify.api-version:2024-01}") String apiVersion,
                              @Value("${shopify.page-size:250}") int pageSize,
                              @Value("${app.sync.max-pages:100}") int maxPages) {
        this.restTemplate = restTemplate;
        this.shopDomain = shopDomain;
        this.accessToken = accessToken;
        this.apiVersion = apiVersion;
        this.pageSize = Math.min(250, Math.max(1, pageSize));
        this.maxPages = Math.max(1, maxPages);
    }

    @Override
    public List<Order> fetchOrders(OffsetDateTime createdAtMin, OffsetDateTime createdAtMax) {
        List<Order> orders = new ArrayList<>();
        URI next = firstPage(createdAtMin, createdAtMax);
        int page = 0;
        while (next != null) {
            if (page >= maxPages) {
                logger.warn("Stopped paging Shopify orders after {} pages; {} orders fetched so far.", maxPages, orders.size());
                break;
            }
            ResponseEntity<ShopifyOrdersResponse> response;
            try {
                response = restTemplate.exchange(next, HttpMethod.GET, new HttpEntity<>(headers()), ShopifyOrdersResponse.class);
            } catch (RestClientException e) {
                throw new SyncException("Failed to fetch orders from Shopify page " + (page + 1), e);
            }
            page++;
            ShopifyOrdersResponse body = response.getBody();
            if (body != null && body.getOrders() != null) {
                orders.addAll(body.getOrders());
            }
            next = nextPage(response.getHeaders().getFirst(HttpHeaders.LINK));
        }
        logger.info("Fetched {} Shopify orders created between {} and {} ({} pages).",
                orders.size(), createdAtMin, createdAtMax, page);
        return orders;
    }

    URI firstPage(OffsetDateTime createdAtMin, OffsetDateTime createdAtMax) {
        return UriComponentsBuilder.newInstance()
                .scheme("https")
                .host(shopDomain)
                .path("/admin/api/{version}/orders.json")
                .queryParam("status", "any")
                .queryParam("limit", pageSize)
                .queryParam("created_at_min", utc(createdAtMin))
                .queryParam("created_at_max", utc(createdAtMax))
                .buildAndExpand(apiVersion)
                .encode()
                .toUri();
    }

    /**
     * The {@code rel="next"} target of a Shopify {@code Link} header, or null on the last page.
     */
    static URI nextPage(String linkHeader) {
        if (linkHeader == null || linkHeader.isBlank()) {
            return null;
        }
        for (String part : linkHeader.split(",")) {
            Matcher matcher = NEXT_LINK.matcher(part.trim());
            if (matcher.find()) {
                return URI.create(matcher.group(1));
            }
        }
        return null;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(ACCESS_TOKEN_HEADER, accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private static String utc(OffsetDateTime value) {
        return value.withOffsetSameInstant(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
