package com.hotlistdigest.enrichment.page;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotlistdigest.core.util.DateTimeParsing;
import com.hotlistdigest.core.util.HtmlUtils;
import com.hotlistdigest.core.util.JsonUtils;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PublishTimeExtractor {
    static final int MAX_HTML_CHARS = 800_000;

    private static final Logger LOGGER = Logger.getLogger(PublishTimeExtractor.class.getName());

    private static final Set<String> META_KEYS = Set.of(
            "article:published_time",
            "og:published_time",
            "publishdate",
            "pubdate",
            "parsely-pub-date",
            "datepublished",
            "dc.date",
            "article:published"
    );
    private static final List<String> JSON_KEYS = List.of(
            "datePublished",
            "dateCreated",
            "publishTime",
            "publishedAt",
            "published_at",
            "pubDate",
            "uploadDate",
            "dateModified"
    );
    private static final List<Pattern> INLINE_PATTERNS = List.of(
            Pattern.compile("\"datePublished\"\\s*:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"dateCreated\"\\s*:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"publish(?:Time|_time|At|_at)\"\\s*:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"pubDate\"\\s*:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"(?:created_at|createdAt)\"\\s*:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"ctime\"\\s*:\\s*\"?(\\d{10,13})\"?", Pattern.CASE_INSENSITIVE)
    );

    private final ZoneId zone;
    private final ObjectMapper mapper;

    public PublishTimeExtractor(ZoneId zone) {
        this.zone = zone;
        this.mapper = JsonUtils.objectMapper();
    }

    public Optional<Instant> fromHtml(String html) {
        if (html == null || html.isEmpty()) {
            return Optional.empty();
        }
        String page = html.length() > MAX_HTML_CHARS ? html.substring(0, MAX_HTML_CHARS) : html;

        List<Object> candidates = new ArrayList<>();
        for (HtmlUtils.MetaTag tag : HtmlUtils.extractMetaTags(page)) {
            if (META_KEYS.contains(tag.key())) {
                candidates.add(tag.content());
            }
        }
        for (String block : HtmlUtils.extractJsonLdBlocks(page)) {
            try {
                collectJsonDates(mapper.readTree(block), candidates);
            } catch (JsonProcessingException e) {
                LOGGER.fine(() -> "Skipping unparseable JSON-LD block: " + e.getOriginalMessage());
            }
        }
        candidates.addAll(HtmlUtils.extractTimeDatetimes(page));
        for (Pattern pattern : INLINE_PATTERNS) {
            Matcher matcher = pattern.matcher(page);
            while (matcher.find()) {
                candidates.add(matcher.group(1));
            }
        }
        return firstParsed(candidates);
    }

    public Optional<Instant> fromJson(JsonNode payload) {
        List<Object> candidates = new ArrayList<>();
        collectJsonDates(payload, candidates);
        return firstParsed(candidates);
    }

    private Optional<Instant> firstParsed(List<Object> candidates) {
        for (Object candidate : candidates) {
            Optional<Instant> parsed = DateTimeParsing.parse(candidate, zone);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static void collectJsonDates(JsonNode node, List<Object> collector) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            for (String key : JSON_KEYS) {
                JsonNode value = node.get(key);
                if (value == null) {
                    continue;
                }
                if (value.isNumber()) {
                    collector.add(value.numberValue());
                } else if (value.isTextual() && !value.asText().isBlank()) {
                    collector.add(value.asText());
                }
            }
            Iterator<JsonNode> children = node.elements();
            while (children.hasNext()) {
                collectJsonDates(children.next(), collector);
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                collectJsonDates(item, collector);
            }
        }
    }
}
