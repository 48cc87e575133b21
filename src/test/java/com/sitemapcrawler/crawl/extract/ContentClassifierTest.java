package com.sitemapcrawler.crawl.extract;

import com.sitemapcrawler.crawl.CrawlFixtures;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.HttpFetchResult;
import com.sitemapcrawler.crawl.model.ResponseClassification;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ContentClassifierTest {
    private final ContentClassifier classifier = new ContentClassifier(new SitemapDocumentParser());
    private final CrawlContext context = CrawlFixtures.context("http://example.com/");

    @Test
    void transportErrorsAndClientErrorsAreFetchErrors() {
        ResponseClassification error = classifier.classify(
            "http://example.com/a", CrawlFixtures.error("http://example.com/a", "timeout"), context);
        ResponseClassification missing = classifier.classify(
            "http://example.com/b", CrawlFixtures.status("http://example.com/b", 404), context);

        assertThat(error).isInstanceOf(ResponseClassification.FetchError.class);
        assertThat(((ResponseClassification.FetchError) error).errorCode()).isEqualTo("timeout");
        assertThat(((ResponseClassification.FetchError) missing).statusCode()).isEqualTo(404);
    }

    @Test
    void nonSuccessStatusIsDropped() {
        ResponseClassification result = classifier.classify(
            "http://example.com/a", CrawlFixtures.status("http://example.com/a", 304), context);

        assertThat(result).isInstanceOf(ResponseClassification.Dropped.class);
    }

    @Test
    void pageRedirectedToAnotherHostIsDropped() {
        ResponseClassification result = classifier.classify(
            "http://example.com/page",
            CrawlFixtures.redirected("http://example.com/page", "https://cdn.example.com/page", "text/html", "<a href=\"/x\">"),
            context
        );

        assertThat(result).isInstanceOf(ResponseClassification.Dropped.class);
    }

    @Test
    void htmlPageCarriesFinalUrlAndLastModified() {
        ResponseClassification result = classifier.classify(
            "http://example.com/old",
            withDates("http://example.com/old", "http://example.com/new", "Wed, 21 Oct 2015 07:28:00 GMT", null),
            context
        );

        ResponseClassification.HtmlPage page = (ResponseClassification.HtmlPage) result;
        assertThat(page.finalUrl()).isEqualTo("http://example.com/new");
        assertThat(page.lastModified()).isEqualTo(Instant.parse("2015-10-21T07:28:00Z"));
    }

    @Test
    void dateHeaderIsUsedWhenLastModifiedIsMissingAndGarbageIsIgnored() {
        ResponseClassification.HtmlPage fromDate = (ResponseClassification.HtmlPage) classifier.classify(
            "http://example.com/a",
            withDates("http://example.com/a", "http://example.com/a", null, "Thu, 01 Jan 2015 00:00:00 GMT"),
            context
        );
        ResponseClassification.HtmlPage garbage = (ResponseClassification.HtmlPage) classifier.classify(
            "http://example.com/b",
            withDates("http://example.com/b", "http://example.com/b", "yesterday", null),
            context
        );

        assertThat(fromDate.lastModified()).isEqualTo(Instant.parse("2015-01-01T00:00:00Z"));
        assertThat(garbage.lastModified()).isNull();
    }

    @Test
    void xmlUrlsetBecomesSitemapLeaf() {
        ResponseClassification result = classifier.classify(
            "http://example.com/feed",
            CrawlFixtures.xml("http://example.com/feed", CrawlFixtures.urlset("http://example.com/a")),
            context
        );

        ResponseClassification.SitemapLeaf leaf = (ResponseClassification.SitemapLeaf) result;
        assertThat(leaf.pageUrls()).containsExactly("http://example.com/a");
        assertThat(leaf.redirectedToTargetDomain()).isFalse();
    }

    @Test
    void sitemapRedirectedOntoTargetIsAttributedToTarget() {
        ResponseClassification result = classifier.classify(
            "http://mirror.net/sitemap.xml",
            CrawlFixtures.redirected(
                "http://mirror.net/sitemap.xml",
                "http://example.com/sitemap.xml",
                "text/xml",
                CrawlFixtures.urlset("http://mirror.net/a?x=1", "http://example.com/b")
            ),
            context
        );

        ResponseClassification.SitemapLeaf leaf = (ResponseClassification.SitemapLeaf) result;
        assertThat(leaf.redirectedToTargetDomain()).isTrue();
        assertThat(leaf.pageUrls()).containsExactly("http://example.com/a?x=1", "http://example.com/b");
    }

    @Test
    void sitemapIndexIsReadEvenFromAnotherHost() {
        ResponseClassification result = classifier.classify(
            "http://static.example.net/sitemap_index.xml",
            CrawlFixtures.xml(
                "http://static.example.net/sitemap_index.xml",
                CrawlFixtures.sitemapIndex("http://example.com/sitemap-1.xml")
            ),
            context
        );

        assertThat(((ResponseClassification.SitemapIndex) result).sitemapUrls())
            .containsExactly("http://example.com/sitemap-1.xml");
    }

    @Test
    void sitemapLookingUrlWithHtmlBodyFallsBackToPage() {
        ResponseClassification result = classifier.classify(
            "http://example.com/sitemap",
            CrawlFixtures.html("http://example.com/sitemap", "<html><a href=\"/a\">a</a></html>"),
            context
        );

        assertThat(result).isInstanceOf(ResponseClassification.HtmlPage.class);
    }

    private HttpFetchResult withDates(String url, String finalUrl, String lastModified, String date) {
        return new HttpFetchResult(
            url,
            URI.create(finalUrl),
            200,
            "<html></html>".getBytes(StandardCharsets.UTF_8),
            "text/html",
            null,
            lastModified,
            date,
            null,
            null
        );
    }
}
