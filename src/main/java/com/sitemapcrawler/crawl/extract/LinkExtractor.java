package com.sitemapcrawler.crawl.extract;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based extraction of anchor targets and image sources. No DOM is built, so markup that
 * a browser would repair is read as written.
 */
public final class LinkExtractor {
    private static final Pattern HREF = Pattern.compile("<a\\s[^>]*href=['\"](.*?)['\"][^>]*?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMG_SRC = Pattern.compile("<img\\s[^>]*src=['\"](.*?)['\"].*?>", Pattern.CASE_INSENSITIVE);

    private LinkExtractor() {
    }

    public static List<String> extractLinks(byte[] body) {
        return findAll(HREF, body, false);
    }

    /**
     * @return image sources in document order, each one once
     */
    public static List<String> extractImageSources(byte[] body) {
        return findAll(IMG_SRC, body, true);
    }

    private static List<String> findAll(Pattern pattern, byte[] body, boolean distinct) {
        if (body == null || body.length == 0) {
            return List.of();
        }
        String html = new String(body, StandardCharsets.UTF_8);
        Matcher matcher = pattern.matcher(html);
        if (distinct) {
            Set<String> found = new LinkedHashSet<>();
            while (matcher.find()) {
                found.add(matcher.group(1));
            }
            return new ArrayList<>(found);
        }
        List<String> found = new ArrayList<>();
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        return found;
    }
}
