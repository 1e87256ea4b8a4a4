package com.hotlistdigest.enrichment.page;

import com.fasterxml.jackson.databind.JsonNode;
import com.hotlistdigest.core.util.DateTimeParsing;
import com.hotlistdigest.core.util.JsonUtils;
import com.hotlistdigest.enrichment.api.PublishTimeFetcher;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class HttpPublishTimeFetcher implements PublishTimeFetcher {
    public static final String HACKER_NEWS_ITEM_API = "https://hacker-news.firebaseio.com/v0/item/";

    private static final Logger LOGGER = Logger.getLogger(HttpPublishTimeFetcher.class.getName());
    private static final Pattern HN_ITEM_ID = Pattern.compile("(?:^|&)id=(\\d+)(?:&|$)");
    private static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";

    private final HttpClient httpClient;
    private final PublishTimeExtractor extractor;
    private final ZoneId zone;
    private final String hackerNewsApiBase;

    public HttpPublishTimeFetcher(HttpClient httpClient, ZoneId zone) {
        this(httpClient, zone, HACKER_NEWS_ITEM_API);
    }

    public HttpPublishTimeFetcher(HttpClient httpClient, ZoneId zone, String hackerNewsApiBase) {
        this.httpClient = httpClient;
        this.zone = zone;
        this.extractor = new PublishTimeExtractor(zone);
        this.hackerNewsApiBase = hackerNewsApiBase;
    }

    @Override
    public Optional<Instant> fetch(String url, Duration timeout) {
        URI uri = URI.create(url.trim());
        // One deadline covers the item API call and the page load.
        long deadline = System.nanoTime() + timeout.toNanos();
        Optional<Instant> fromHackerNews = hackerNewsItemId(uri).flatMap(id -> hackerNewsTime(id, timeout));
        if (fromHackerNews.isPresent()) {
            return fromHackerNews;
        }

        Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
        if (remaining.isNegative() || remaining.isZero()) {
            throw new IllegalStateException("Request timed out after " + timeout.toMillis() + "ms for " + uri);
        }
        HttpResponse<String> response = get(uri, remaining, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        if (response.statusCode() / 100 != 2) {
            throw new IllegalStateException("Article request failed with status " + response.statusCode() + " for " + uri);
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (contentType.contains("application/json")) {
            return extractor.fromJson(readJson(response.body(), uri));
        }
        return extractor.fromHtml(response.body());
    }

    static Optional<String> hackerNewsItemId(URI uri) {
        String host = uri.getHost();
        if (host == null || !host.toLowerCase(Locale.ROOT).contains("news.ycombinator.com")) {
            return Optional.empty();
        }
        String query = uri.getRawQuery();
        if (query == null) {
            return Optional.empty();
        }
        Matcher matcher = HN_ITEM_ID.matcher(query);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private Optional<Instant> hackerNewsTime(String itemId, Duration timeout) {
        URI api = URI.create(hackerNewsApiBase + itemId + ".json");
        try {
            HttpResponse<String> response = get(api, timeout, "application/json");
            if (response.statusCode() / 100 != 2) {
                return Optional.empty();
            }
            JsonNode time = readJson(response.body(), api).path("time");
            return time.isNumber() ? DateTimeParsing.parse(time.numberValue(), zone) : Optional.empty();
        } catch (RuntimeException e) {
            LOGGER.fine(() -> "Hacker News item lookup failed for " + itemId + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private HttpResponse<String> get(URI uri, Duration timeout, String accept) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", accept)
                .header("Accept-Language", "zh-CN,zh;q=0.9,en;q=0.8")
                .header("Cache-Control", "no-cache")
                .build();
        CompletableFuture<HttpResponse<String>> pending =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new IllegalStateException("Request timed out after " + timeout.toMillis() + "ms for " + uri, e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Request interrupted for " + uri, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Request failed for " + uri + ": " + rootMessage(e), e.getCause());
        }
    }

    private static JsonNode readJson(String body, URI uri) {
        try {
            return JsonUtils.objectMapper().readTree(body);
        } catch (IOException e) {
            throw new IllegalStateException("Invalid JSON payload from " + uri, e);
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
