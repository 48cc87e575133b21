package com.sitemapcrawler.crawl.extract;

import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.HttpFetchResult;
import com.sitemapcrawler.crawl.model.ResponseClassification;
import com.sitemapcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides what a fetched response is. Sitemap XML is tried first when the response looks like
 * one; everything else that stayed on the target host with a 2xx status is an HTML page.
 */
@Component
public class ContentClassifier {
    private static final Logger log = LoggerFactory.getLogger(ContentClassifier.class);

    private final SitemapDocumentParser sitemapParser;

    public ContentClassifier(SitemapDocumentParser sitemapParser) {
        this.sitemapParser = sitemapParser;
    }

    public ResponseClassification classify(String requestedUrl, HttpFetchResult fetch, CrawlContext context) {
        if (fetch.errorCode() != null || fetch.statusCode() >= 400) {
            return new ResponseClassification.FetchError(requestedUrl, fetch.statusCode(), fetch.errorCode());
        }
        String finalUrl = fetch.finalUrlOrRequested();
        if (!fetch.isSuccessful()) {
            log.info("Skipping {} - non-2XX status code: {}", finalUrl, fetch.statusCode());
            return new ResponseClassification.Dropped(requestedUrl, "status " + fetch.statusCode());
        }

        if (looksLikeXml(requestedUrl, fetch)) {
            ResponseClassification sitemap = classifySitemap(requestedUrl, finalUrl, fetch, context);
            if (sitemap != null) {
                return sitemap;
            }
        }

        String finalHost = UrlNormalizer.authorityOf(finalUrl);
        if (!context.isTargetHost(finalHost)) {
            log.info("Skipping {} - redirected to different domain ({} != {})", finalUrl, finalHost, context.targetHost());
            return new ResponseClassification.Dropped(requestedUrl, "foreign host " + finalHost);
        }
        return new ResponseClassification.HtmlPage(
            requestedUrl,
            finalUrl,
            fetch.bodyBytes(),
            parseHttpDate(fetch.lastModifiedOrDate())
        );
    }

    boolean looksLikeXml(String requestedUrl, HttpFetchResult fetch) {
        String contentType = fetch.contentType() == null ? "" : fetch.contentType().toLowerCase(Locale.ROOT);
        return contentType.contains("xml")
            || requestedUrl.endsWith(".xml")
            || requestedUrl.toLowerCase(Locale.ROOT).contains("sitemap");
    }

    private ResponseClassification classifySitemap(
        String requestedUrl,
        String finalUrl,
        HttpFetchResult fetch,
        CrawlContext context
    ) {
        SitemapDocument document = sitemapParser.parse(requestedUrl, fetch);
        switch (document.kind()) {
            case INDEX -> {
                log.info("Found sitemap index at {}", requestedUrl);
                return new ResponseClassification.SitemapIndex(requestedUrl, document.locations());
            }
            case URLSET -> {
                log.info("Found sitemap at {}", requestedUrl);
                boolean redirectedToTarget = !requestedUrl.equals(finalUrl)
                    && context.isTargetHost(UrlNormalizer.authorityOf(finalUrl))
                    && !context.isTargetHost(UrlNormalizer.authorityOf(requestedUrl));
                List<String> pageUrls = redirectedToTarget
                    ? attributeToTarget(document.locations(), context)
                    : document.locations();
                return new ResponseClassification.SitemapLeaf(requestedUrl, pageUrls, redirectedToTarget);
            }
            default -> {
                log.debug("{} looked like a sitemap but is not one", requestedUrl);
                return null;
            }
        }
    }

    private List<String> attributeToTarget(List<String> locations, CrawlContext context) {
        List<String> rewritten = new ArrayList<>(locations.size());
        for (String location : locations) {
            if (context.isTargetHost(UrlNormalizer.authorityOf(location))) {
                rewritten.add(location);
            } else {
                String moved = UrlNormalizer.rebase(location, context.scheme(), context.targetHost());
                log.debug("Normalized {} -> {}", location, moved);
                rewritten.add(moved);
            }
        }
        return rewritten;
    }

    /**
     * @return the instant, or {@code null} when the header is missing or not an RFC 1123 date
     */
    static Instant parseHttpDate(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(header.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date header {}: {}", header, e.getMessage());
            return null;
        }
    }
}
