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
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a subreddit listing ({@code /r/{topic}.json?after=...})
 *
 * @author William Callahan
 *
 * Features:
 * - Uses the {@code data.after} token as continuation cursor
 * - Skips posts without a usable {@code url}
 * - Appends {@code .jpg} to links without an image extension so image hosts serve the raw file
 */
@Service
public class RedditListingSource extends AbstractJsonListingSource {

    private static final Logger logger = LoggerFactory.getLogger(RedditListingSource.class);
    private static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".bmp");

    private final String baseUrl;
    private final String userAgent;

    public RedditListingSource(WebClient.Builder webClientBuilder, MosaicConfigurationProperties properties) {
        super(webClientBuilder, properties.getListing().getTimeout());
        this.baseUrl = properties.getListing().getReddit().getBaseUrl();
        this.userAgent = properties.getListing().getReddit().getUserAgent();
    }

    @Override
    public ListingProvider provider() {
        return ListingProvider.REDDIT;
    }

    @Override
    protected Logger log() {
        return logger;
    }

    @Override
    protected URI buildPageUrl(String topic, String cursor) {
        return UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment("r", topic + ".json")
            .queryParamIfPresent("after", Optional.ofNullable(cursor).filter(StringUtils::hasText))
            .build()
            .encode()
            .toUri();
    }

    @Override
    protected void customizeHeaders(HttpHeaders headers) {
        if (StringUtils.hasText(userAgent)) {
            headers.set(HttpHeaders.USER_AGENT, userAgent);
        }
    }

    @Override
    protected ListingPage parsePage(String topic, String cursor, JsonNode body) {
        JsonNode data = body.path("data");
        JsonNode children = data.path("children");
        if (!data.isObject() || !children.isArray()) {
            throw new SourceUnavailableException("Reddit listing for '" + topic + "' has no data.children array");
        }

        List<String> items = new ArrayList<>(children.size());
        for (JsonNode child : children) {
            String url = textOrNull(child.path("data").path("url"));
            if (url == null) {
                logger.debug("Skipping Reddit post without url in '{}'", topic);
                continue;
            }
            items.add(withImageExtension(url));
        }
        return new ListingPage(items, textOrNull(data.path("after")));
    }

    static String withImageExtension(String url) {
        String path = url;
        int queryStart = path.indexOf('?');
        if (queryStart >= 0) {
            path = path.substring(0, queryStart);
        }
        String lower = path.toLowerCase(Locale.ROOT);
        for (String extension : IMAGE_EXTENSIONS) {
            if (lower.endsWith(extension)) {
                return url;
            }
        }
        return queryStart >= 0 ? path + ".jpg" + url.substring(queryStart) : url + ".jpg";
    }
}
