package com.sitemapcrawler.crawl.service;

import com.sitemapcrawler.crawl.extract.LinkExtractor;
import com.sitemapcrawler.crawl.extract.LinkScreener;
import com.sitemapcrawler.crawl.fetch.PageFetcher;
import com.sitemapcrawler.crawl.frontier.Admission;
import com.sitemapcrawler.crawl.frontier.Frontier;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.ResponseClassification;
import com.sitemapcrawler.crawl.model.SitemapEntry;
import com.sitemapcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetch, classify and merge for a single frontier URL. Safe to call from several workers of
 * the same run at once.
 */
@Component
public class PageProcessor {
    private static final Logger log = LoggerFactory.getLogger(PageProcessor.class);

    private final PageFetcher pageFetcher;
    private final LinkScreener linkScreener;

    public PageProcessor(PageFetcher pageFetcher, LinkScreener linkScreener) {
        this.pageFetcher = pageFetcher;
        this.linkScreener = linkScreener;
    }

    public void process(String url, CrawlRun run) {
        log.info("Crawling #{}: {}", run.nextCrawlNumber(), url);
        try {
            ResponseClassification classification = pageFetcher.fetch(url, run.context(), run::recordStatus);
            if (classification instanceof ResponseClassification.SitemapIndex index) {
                mergeSitemapIndex(index, run);
            } else if (classification instanceof ResponseClassification.SitemapLeaf leaf) {
                mergeSitemapLeaf(leaf, run);
            } else if (classification instanceof ResponseClassification.HtmlPage page) {
                mergePage(page, run);
            } else if (classification instanceof ResponseClassification.Unfetched unfetched) {
                run.addEntry(SitemapEntry.of(unfetched.url()));
            } else if (classification instanceof ResponseClassification.FetchError error) {
                log.debug("fetch error url={} status={} errorCode={}", url, error.statusCode(), error.errorCode());
            } else if (classification instanceof ResponseClassification.Dropped dropped) {
                log.debug("dropped url={} reason={}", url, dropped.reason());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to process {}", url, e);
        }
    }

    private void mergeSitemapIndex(ResponseClassification.SitemapIndex index, CrawlRun run) {
        int depth = run.sitemapDepth(index.url());
        int maxDepth = run.context().maxSitemapDepth();
        if (depth >= maxDepth) {
            log.warn("Sitemap index {} nested deeper than {}; not following", index.url(), maxDepth);
            return;
        }
        for (String location : index.sitemapUrls()) {
            String sitemapUrl = linkScreener.toTargetHost(UrlNormalizer.normalize(location), run.context());
            if (run.frontier().enqueue(sitemapUrl)) {
                run.recordSitemapDepth(sitemapUrl, depth + 1);
                log.debug("Added sitemap to crawl: {}", sitemapUrl);
            }
        }
    }

    private void mergeSitemapLeaf(ResponseClassification.SitemapLeaf leaf, CrawlRun run) {
        CrawlContext context = run.context();
        Frontier frontier = run.frontier();
        int added = 0;
        for (String location : leaf.pageUrls()) {
            String pageUrl = linkScreener.toTargetHost(UrlNormalizer.normalize(location), context);
            if (!context.isTargetHost(UrlNormalizer.authorityOf(pageUrl))) {
                log.debug("Ignoring foreign URL {} from sitemap {}", pageUrl, leaf.url());
                continue;
            }
            if (!context.passesExclusions(pageUrl)) {
                log.debug("Excluded URL from sitemap: {}", pageUrl);
                frontier.markExcluded(pageUrl, Admission.EXCLUDED_BY_POLICY);
                continue;
            }
            if (frontier.claimForOutput(pageUrl) && run.addEntry(SitemapEntry.of(pageUrl))) {
                added++;
            }
        }
        log.debug("Added {} URLs from sitemap {}", added, leaf.url());
    }

    private void mergePage(ResponseClassification.HtmlPage page, CrawlRun run) {
        CrawlContext context = run.context();
        List<String> images = new ArrayList<>();
        if (context.images()) {
            for (String source : LinkExtractor.extractImageSources(page.body())) {
                String image = linkScreener.resolveImage(page.finalUrl(), source, context, run.robots());
                if (image != null && !images.contains(image)) {
                    images.add(image);
                }
            }
        }
        run.addEntry(new SitemapEntry(page.finalUrl(), page.lastModified(), images));

        for (String rawLink : LinkExtractor.extractLinks(page.body())) {
            String link = linkScreener.normalizeLink(page.finalUrl(), rawLink, context);
            if (link == null) {
                continue;
            }
            Admission admission = run.frontier().admit(link, () -> linkScreener.screen(link, context, run.robots()));
            if (admission == Admission.QUEUED) {
                log.debug("Found {} on {}", link, page.finalUrl());
            }
        }
    }
}
