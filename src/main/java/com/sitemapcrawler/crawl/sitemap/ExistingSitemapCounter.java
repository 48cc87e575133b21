package com.sitemapcrawler.crawl.sitemap;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Counts the {@code <url>} entries of a previously written sitemap. An index is followed to the
 * files it names, looked up by file name next to the index.
 */
@Component
public class ExistingSitemapCounter {
    private static final Logger log = LoggerFactory.getLogger(ExistingSitemapCounter.class);
    private static final int MAX_INDEX_DEPTH = 5;

    /**
     * @return the number of URLs, or {@code null} when there is no readable sitemap at the path
     */
    public Integer count(Path file) {
        return count(file, 0);
    }

    private Integer count(Path file, int depth) {
        if (file == null || !Files.isRegularFile(file)) {
            return null;
        }
        Document xml;
        try {
            xml = Jsoup.parse(Files.readString(file, StandardCharsets.UTF_8), "", Parser.xmlParser());
        } catch (IOException | RuntimeException e) {
            log.error("Error parsing sitemap file {}: {}", file, e.getMessage());
            return null;
        }
        Element root = xml.children().first();
        String rootName = root == null ? "" : localName(root);
        if ("urlset".equals(rootName)) {
            return (int) root.children().stream().filter(child -> "url".equals(localName(child))).count();
        }
        if (!"sitemapindex".equals(rootName)) {
            log.warn("Unknown sitemap root tag {} in {}", rootName, file);
            return null;
        }
        if (depth >= MAX_INDEX_DEPTH) {
            log.warn("Sitemap index {} nested deeper than {}", file, MAX_INDEX_DEPTH);
            return 0;
        }

        int total = 0;
        Path directory = file.toAbsolutePath().getParent();
        for (Element sitemap : root.children()) {
            if (!"sitemap".equals(localName(sitemap))) {
                continue;
            }
            String loc = locOf(sitemap);
            if (loc == null) {
                continue;
            }
            Path child = directory.resolve(fileNameOf(loc));
            Integer childCount = count(child, depth + 1);
            if (childCount == null) {
                log.warn("Could not count URLs in referenced sitemap: {}", child);
            } else {
                total += childCount;
            }
        }
        return total;
    }

    private static String locOf(Element sitemap) {
        for (Element child : sitemap.children()) {
            if ("loc".equals(localName(child)) && !child.text().isBlank()) {
                return child.text().trim();
            }
        }
        return null;
    }

    static String fileNameOf(String location) {
        String path = location;
        int schemeEnd = path.indexOf("://");
        if (schemeEnd >= 0) {
            int slash = path.indexOf('/', schemeEnd + 3);
            path = slash < 0 ? "" : path.substring(slash);
        }
        int cut = path.length();
        for (char stop : new char[] {'?', '#'}) {
            int idx = path.indexOf(stop);
            if (idx >= 0 && idx < cut) {
                cut = idx;
            }
        }
        path = path.substring(0, cut);
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static String localName(Element element) {
        String name = element.tagName().toLowerCase(Locale.ROOT);
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
