package com.hotlistdigest.core.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern META_TAG_PATTERN = Pattern.compile("<meta\\b[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile(
            "([a-zA-Z_:][-a-zA-Z0-9_:.]*)\\s*=\\s*([\"'])(.*?)\\2",
            Pattern.DOTALL
    );
    private static final Pattern JSON_LD_PATTERN = Pattern.compile(
            "<script[^>]*type\\s*=\\s*[\"']application/ld\\+json[\"'][^>]*>(.*?)</script>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern TIME_TAG_PATTERN = Pattern.compile(
            "<time\\b[^>]*datetime\\s*=\\s*[\"']([^\"']+)[\"'][^>]*>",
            Pattern.CASE_INSENSITIVE
    );

    private HtmlUtils() {
    }

    public static List<MetaTag> extractMetaTags(String html) {
        Matcher matcher = META_TAG_PATTERN.matcher(html);
        List<MetaTag> tags = new ArrayList<>();
        while (matcher.find()) {
            Map<String, String> attributes = attributesOf(matcher.group());
            String key = attributes.containsKey("property") ? attributes.get("property") : attributes.get("name");
            String content = attributes.getOrDefault("content", "");
            if (key != null && !key.isBlank() && !content.isBlank()) {
                tags.add(new MetaTag(key.trim().toLowerCase(Locale.ROOT), content.trim()));
            }
        }
        return tags;
    }

    public static List<String> extractJsonLdBlocks(String html) {
        Matcher matcher = JSON_LD_PATTERN.matcher(html);
        List<String> blocks = new ArrayList<>();
        while (matcher.find()) {
            String payload = matcher.group(1).trim();
            if (payload.startsWith("<!--") && payload.endsWith("-->")) {
                payload = payload.substring(4, payload.length() - 3).trim();
            }
            if (!payload.isEmpty()) {
                blocks.add(payload);
            }
        }
        return blocks;
    }

    public static List<String> extractTimeDatetimes(String html) {
        Matcher matcher = TIME_TAG_PATTERN.matcher(html);
        List<String> values = new ArrayList<>();
        while (matcher.find()) {
            values.add(matcher.group(1).trim());
        }
        return values;
    }

    private static Map<String, String> attributesOf(String tag) {
        Matcher matcher = ATTRIBUTE_PATTERN.matcher(tag);
        Map<String, String> attributes = new HashMap<>();
        while (matcher.find()) {
            attributes.putIfAbsent(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(3));
        }
        return attributes;
    }

    public record MetaTag(String key, String content) {
    }
}
