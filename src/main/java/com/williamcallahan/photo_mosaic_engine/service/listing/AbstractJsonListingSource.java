/**
 * Shared HTTP plumbing for JSON listing APIs
 *
 * @author William Callahan
 *
 * Features:
 * - Issues one blocking GET per page with a bounded timeout
 * - Parses into a Jackson tree so unknown fields never break parsing
 * - Converts every transport or decoding failure into SourceUnavailableException
 * - Logs attempts, results and failures through ExternalApiLogger
 */
package com.williamcallahan.photo_mosaic_engine.service.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.photo_mosaic_engine.exception.SourceUnavailableException;
import com.williamcallahan.photo_mosaic_engine.model.ListingPage;
import com.williamcallahan.photo_mosaic_engine.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

public abstract class AbstractJsonListingSource implements ListingSource {

    private final WebClient webClient;
    private final Duration timeout;

    protected AbstractJsonListingSource(WebClient.Builder webClientBuilder, Duration timeout) {
        this.webClient = webClientBuilder.build();
        this.timeout = timeout;
    }

    protected abstract Logger log();

    @Override
    public final ListingPage listPage(String topic, String cursor) {
        if (!StringUtils.hasText(topic)) {
            throw new IllegalArgumentException("Listing topic must not be blank");
        }
        String apiName = provider().getDisplayName();
        ExternalApiLogger.logListingAttempt(log(), apiName, topic, cursor);

        URI url = buildPageUrl(topic.trim(), cursor);
        JsonNode body = fetchJson(topic, url);
        ListingPage page = parsePage(topic, cursor, body);

        ExternalApiLogger.logListingSuccess(log(), apiName, topic, page.items().size(), page.nextCursor());
        return page;
    }

    /**
     * Absolute URL of the listing page for {@code cursor}
     */
    protected abstract URI buildPageUrl(String topic, String cursor);

    /**
     * Adds provider-specific headers (authorization, user agent)
     */
    protected void customizeHeaders(HttpHeaders headers) {
    }

    /**
     * Extracts candidates and the next cursor; throws SourceUnavailableException when critical fields are absent
     */
    protected abstract ListingPage parsePage(String topic, String cursor, JsonNode body);

    private JsonNode fetchJson(String topic, URI url) {
        String apiName = provider().getDisplayName();
        ExternalApiLogger.logHttpRequest(log(), "GET", url.toString());
        JsonNode body;
        try {
            body = webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .headers(this::customizeHeaders)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String reason;
            if (cause instanceof WebClientResponseException wcre) {
                reason = "HTTP status " + wcre.getStatusCode().value();
            } else if (cause instanceof TimeoutException) {
                reason = "timed out after " + timeout.toMillis() + " ms";
            } else {
                reason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            }
            ExternalApiLogger.logListingFailure(log(), apiName, topic, url.toString(), reason);
            throw new SourceUnavailableException(apiName + " listing unavailable for topic '" + topic + "': " + reason, cause);
        }
        if (body == null || body.isMissingNode() || body.isNull()) {
            ExternalApiLogger.logListingFailure(log(), apiName, topic, url.toString(), "empty body");
            throw new SourceUnavailableException(apiName + " listing returned an empty body for topic '" + topic + "'");
        }
        return body;
    }

    /**
     * Text value of {@code node}, or {@code null} when it is missing, not textual, or blank
     */
    protected static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
