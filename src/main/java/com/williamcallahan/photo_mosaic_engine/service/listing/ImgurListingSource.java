package com.williamcallahan.photo_mosaic_engine.service.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.photo_mosaic_engine.config.MosaicConfigurationProperties;
import com.williamcallahan.photo_mosaic_engine.exception.SourceUnavailableException;
import com.williamcallahan.photo_mosaic_engine.model.ListingPage;
import com.williamcallahan.photo_mosaic_engine.types.ListingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the top posts of an Imgur subreddit gallery ({@code /3/gallery/r/{topic}/top/{page}.json})
 *
 * @author William Callahan
 *
 * Features:
 * - Uses the zero-based page number as continuation cursor; an empty page ends the listing
 * - Sends the configured {@code Client-ID} authorization
 * - Optionally rewrites links to Imgur's small-square thumbnails ({@code abc.jpg -> abcs.jpg})
 * - Skips album entries, which do not point at a single image
 */
@Service
public class ImgurListingSource extends AbstractJsonListingSource {

    private static final Logger logger = LoggerFactory.getLogger(ImgurListingSource.class);
    private static final Pattern THREE_LETTER_EXTENSION = Pattern.compile("\\.([a-z]{3})$");

    private final String baseUrl;
    private final String clientId;
    private final boolean useThumbnails;

    public ImgurListingSource(WebClient.Builder webClientBuilder, MosaicConfigurationProperties properties) {
        super(webClientBuilder, properties.getListing().getTimeout());
        MosaicConfigurationProperties.Listing.Imgur imgur = properties.getListing().getImgur();
        this.baseUrl = imgur.getBaseUrl();
        this.clientId = imgur.getClientId();
        this.useThumbnails = imgur.isUseThumbnails();
    }

    @Override
    public ListingProvider provider() {
        return ListingProvider.IMGUR;
    }

    @Override
    protected Logger log() {
        return logger;
    }

    @Override
    protected URI buildPageUrl(String topic, String cursor) {
        if (!StringUtils.hasText(clientId)) {
            throw new SourceUnavailableException("Imgur client id is not configured (mosaic.listing.imgur.client-id)");
        }
        return UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment("3", "gallery", "r", topic, "top", pageNumber(cursor) + ".json")
            .build()
            .encode()
            .toUri();
    }

    @Override
    protected void customizeHeaders(HttpHeaders headers) {
        headers.set(HttpHeaders.AUTHORIZATION, "Client-ID " + clientId);
    }

    @Override
    protected ListingPage parsePage(String topic, String cursor, JsonNode body) {
        if (body.has("success") && !body.path("success").asBoolean(true)) {
            throw new SourceUnavailableException("Imgur gallery for '" + topic + "' reported failure, status "
                + body.path("status").asInt(0));
        }
        JsonNode data = body.path("data");
        if (!data.isArray()) {
            throw new SourceUnavailableException("Imgur gallery for '" + topic + "' has no data array");
        }
        if (data.isEmpty()) {
            return ListingPage.last(List.of());
        }

        List<String> items = new ArrayList<>(data.size());
        for (JsonNode post : data) {
            if (post.path("is_album").asBoolean(false)) {
                continue;
            }
            String link = textOrNull(post.path("link"));
            if (link == null) {
                continue;
            }
            items.add(useThumbnails ? toThumbnail(link) : link);
        }
        return new ListingPage(items, String.valueOf(pageNumber(cursor) + 1));
    }

    static String toThumbnail(String link) {
        return THREE_LETTER_EXTENSION.matcher(link).replaceAll("s.$1");
    }

    private static int pageNumber(String cursor) {
        if (!StringUtils.hasText(cursor)) {
            return 0;
        }
        try {
            return Integer.parseInt(cursor.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Imgur cursor must be a page number: " + cursor, e);
        }
    }
}
