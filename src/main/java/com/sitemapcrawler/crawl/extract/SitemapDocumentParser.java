package com.sitemapcrawler.crawl.extract;

import com.sitemapcrawler.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Reads sitemap XML. Tags are matched by local name so both plain and prefixed
 * ({@code <sm:loc>}) documents are understood.
 */
@Component
public class SitemapDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(SitemapDocumentParser.class);

    public SitemapDocument parse(String sitemapUrl, HttpFetchResult fetch) {
        String xmlPayload;
        try {
            xmlPayload = extractXmlPayload(sitemapUrl, fetch);
        } catch (IOException e) {
            log.debug("Failed to inflate sitemap {}: {}", sitemapUrl, e.getMessage());
            return SitemapDocument.notASitemap();
        }
        return parse(xmlPayload);
    }

    public SitemapDocument parse(String xmlPayload) {
        if (xmlPayload == null || xmlPayload.isBlank()) {
            return SitemapDocument.notASitemap();
        }
        Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
        Element root = xml.children().first();
        if (root == null) {
            return SitemapDocument.notASitemap();
        }
        String rootName = localName(root);
        if ("sitemapindex".equals(rootName)) {
            return new SitemapDocument(SitemapDocument.Kind.INDEX, locationsUnder(xml, "sitemap"));
        }
        if ("urlset".equals(rootName)) {
            return new SitemapDocument(SitemapDocument.Kind.URLSET, locationsUnder(xml, "url"));
        }
        return SitemapDocument.notASitemap();
    }

    private List<String> locationsUnder(Document xml, String parentName) {
        List<String> locations = new ArrayList<>();
        for (Element element : xml.getAllElements()) {
            if (!parentName.equals(localName(element))) {
                continue;
            }
            for (Element child : element.children()) {
                if ("loc".equals(localName(child))) {
                    String loc = child.text().trim();
                    if (!loc.isEmpty()) {
                        locations.add(loc);
                    }
                    break;
                }
            }
        }
        return locations;
    }

    private static String localName(Element element) {
        String name = element.tagName().toLowerCase(Locale.ROOT);
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null) {
            return null;
        }
        if (isGzipPayload(sitemapUrl, fetch, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    /**
     * A {@code .gz} name or a gzip content encoding is only trusted when the body actually starts
     * with the gzip magic bytes; some servers label plain XML that way.
     */
    private boolean isGzipPayload(String sitemapUrl, HttpFetchResult fetch, byte[] bodyBytes) {
        boolean magic = bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
        if (!magic) {
            return false;
        }
        String requestedUrl = sitemapUrl == null ? "" : sitemapUrl.toLowerCase(Locale.ROOT);
        String resolvedUrl = fetch.finalUrlOrRequested() == null
            ? ""
            : fetch.finalUrlOrRequested().toLowerCase(Locale.ROOT);
        if (!requestedUrl.endsWith(".gz") && !resolvedUrl.endsWith(".gz")
            && !containsIgnoreCase(fetch.contentEncoding(), "gzip")) {
            log.debug("Sitemap {} is gzip without a gzip name or encoding", sitemapUrl);
        }
        return true;
    }

    private boolean containsIgnoreCase(String value, String token) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(token);
    }
}
