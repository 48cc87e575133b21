package com.sitemapcrawler.crawl.service;

import com.sitemapcrawler.crawl.frontier.Frontier;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.CrawlOutcome;
import com.sitemapcrawler.crawl.model.CrawlPhase;
import com.sitemapcrawler.crawl.model.SitemapWriteResult;
import com.sitemapcrawler.crawl.robots.RobotsTxtService;
import com.sitemapcrawler.crawl.sitemap.SitemapWriter;
import com.sitemapcrawler.crawl.util.NamedThreadFactory;
import com.sitemapcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Drives one site from seeding to the written sitemap. Each call owns its own {@link CrawlRun},
 * so several sites can be crawled by the same instance at once.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    private final RobotsTxtService robotsTxtService;
    private final PageProcessor pageProcessor;
    private final SitemapWriter sitemapWriter;

    public CrawlOrchestratorService(
        RobotsTxtService robotsTxtService,
        PageProcessor pageProcessor,
        SitemapWriter sitemapWriter
    ) {
        this.robotsTxtService = robotsTxtService;
        this.pageProcessor = pageProcessor;
        this.sitemapWriter = sitemapWriter;
    }

    public CrawlOutcome run(CrawlContext context) {
        return run(newRun(context));
    }

    public CrawlRun newRun(CrawlContext context) {
        return new CrawlRun(context, robotsTxtService.loadPolicy(context));
    }

    public CrawlOutcome run(CrawlRun run) {
        CrawlContext context = run.context();
        log.info("Start the crawling process for {} workers={}", context.domain(), context.numWorkers());

        run.moveTo(CrawlPhase.SEEDING);
        seed(run);

        run.moveTo(CrawlPhase.CRAWLING);
        if (context.numWorkers() == 1) {
            crawlSequentially(run);
        } else {
            crawlInRounds(run);
        }

        run.moveTo(CrawlPhase.DRAINING);
        log.info("Crawling has reached end of all found links for {}", context.domain());

        run.moveTo(CrawlPhase.WRITING);
        SitemapWriteResult result = sitemapWriter.write(run.entries(), context);

        run.moveTo(CrawlPhase.DONE);
        log.info(
            "Crawl of {} finished written={} entries={} result={}",
            context.domain(),
            result.isWritten(),
            run.entries().size(),
            result.getClass().getSimpleName()
        );
        return new CrawlOutcome(run.toReport(), result);
    }

    void seed(CrawlRun run) {
        CrawlContext context = run.context();
        Frontier frontier = run.frontier();
        for (String sitemapUrl : context.sitemapUrls()) {
            frontier.seed(UrlNormalizer.normalize(sitemapUrl));
            log.info("Added sitemap URL to crawl queue: {}", sitemapUrl);
        }
        if (!context.sitemapOnly()) {
            frontier.seed(UrlNormalizer.normalize(context.domain()));
        } else if (context.sitemapUrls().isEmpty()) {
            log.warn("sitemap-only set for {} but no sitemap URL given, falling back to domain", context.domain());
            frontier.seed(UrlNormalizer.normalize(context.domain()));
        }
    }

    private void crawlSequentially(CrawlRun run) {
        String url;
        while ((url = run.frontier().poll()) != null) {
            pageProcessor.process(url, run);
        }
    }

    private void crawlInRounds(CrawlRun run) {
        CrawlContext context = run.context();
        ExecutorService pool = Executors.newFixedThreadPool(
            context.numWorkers(),
            new NamedThreadFactory("crawl-" + context.targetHost())
        );
        try {
            int round = 0;
            while (true) {
                List<String> batch = run.frontier().drainRound();
                if (batch.isEmpty()) {
                    break;
                }
                round++;
                log.debug("round={} dispatching={} domain={}", round, batch.size(), context.domain());
                List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
                for (String url : batch) {
                    futures.add(CompletableFuture.runAsync(() -> pageProcessor.process(url, run), pool));
                }
                try {
                    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
                } catch (CompletionException e) {
                    log.warn("Crawl round {} for {} had a failed task", round, context.domain(), e);
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
