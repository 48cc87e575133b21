package com.sitemapcrawler.crawl.service;

import com.sitemapcrawler.config.CrawlerProperties;
import com.sitemapcrawler.config.SiteConfigLoader;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.CrawlOutcome;
import com.sitemapcrawler.crawl.model.CrawlReport;
import com.sitemapcrawler.crawl.model.SitemapWriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class SitemapCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SitemapCliRunner.class);
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 2;

    private final CrawlerProperties properties;
    private final SiteConfigLoader siteConfigLoader;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public SitemapCliRunner(
        CrawlerProperties properties,
        SiteConfigLoader siteConfigLoader,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.siteConfigLoader = siteConfigLoader;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int status = runAll();

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }

    /**
     * Crawls every configured site in turn. A failing site never stops the batch.
     *
     * @return {@link #EXIT_FAILURES} when any site failed, {@link #EXIT_OK} otherwise
     */
    int runAll() {
        List<CrawlerProperties.Site> sites = collectSites();
        if (sites.isEmpty()) {
            log.warn("No sites configured; set crawler.sites or crawler.cli.config-file");
            return EXIT_OK;
        }

        List<String> failures = new ArrayList<>();
        for (CrawlerProperties.Site site : sites) {
            String failure = runSite(site);
            if (failure != null) {
                failures.add(failure);
            }
        }

        if (failures.isEmpty()) {
            log.info("All {} sites completed", sites.size());
            return EXIT_OK;
        }
        log.error("{} of {} sites failed:", failures.size(), sites.size());
        for (String failure : failures) {
            log.error("  {}", failure);
        }
        writeFailures(failures);
        return EXIT_FAILURES;
    }

    private List<CrawlerProperties.Site> collectSites() {
        List<CrawlerProperties.Site> sites = new ArrayList<>(properties.getSites());
        String configFile = properties.getCli().getConfigFile();
        if (configFile != null && !configFile.isBlank()) {
            sites.addAll(siteConfigLoader.load(Path.of(configFile.trim())));
        }
        List<CrawlerProperties.Site> runnable = new ArrayList<>(sites.size());
        for (int i = 0; i < sites.size(); i++) {
            CrawlerProperties.Site site = sites.get(i);
            if (site.getDomain() == null || site.getDomain().isBlank()) {
                log.warn("Skipping site #{}: you must provide a domain to use the crawler", i + 1);
                continue;
            }
            runnable.add(site);
        }
        return runnable;
    }

    /**
     * @return a one-line failure description, or {@code null} when the sitemap was written
     */
    private String runSite(CrawlerProperties.Site site) {
        CrawlContext context;
        try {
            context = CrawlContext.from(site, properties);
        } catch (InvalidCrawlConfigurationException e) {
            log.error("Invalid configuration for {}: {}", site.getDomain(), e.getMessage());
            return site.getDomain() + ": invalid configuration: " + e.getMessage();
        }

        try {
            CrawlOutcome outcome = crawlOrchestratorService.run(context);
            if (context.report()) {
                logReport(outcome.report(), context);
            }
            return describeFailure(outcome.writeResult());
        } catch (UncheckedIOException e) {
            log.error("Could not write sitemap for {}", context.domain(), e);
            return context.domain() + ": output error: " + e.getMessage();
        } catch (RuntimeException e) {
            log.error("Crawl of {} failed", context.domain(), e);
            return context.domain() + ": crawl error: " + e.getMessage();
        }
    }

    static String describeFailure(SitemapWriteResult result) {
        if (result instanceof SitemapWriteResult.DriftExceeded drift) {
            return String.format(
                Locale.ROOT,
                "%s: URL count difference %d exceeds threshold (old=%d, new=%d, threshold=%s, threshold_percent=%s)",
                drift.domain(),
                drift.diff(),
                drift.oldCount(),
                drift.newCount(),
                drift.threshold(),
                drift.thresholdPercent()
            );
        }
        if (result instanceof SitemapWriteResult.EmptySitemap empty) {
            return empty.domain() + ": crawl produced no URLs";
        }
        return null;
    }

    private void logReport(CrawlReport report, CrawlContext context) {
        log.info("Number of found URL : {}", report.discoveredCount());
        log.info("Number of links crawled : {}", report.crawledCount());
        if (context.parseRobots()) {
            log.info("Number of link block by robots.txt : {}", report.blockedByRobotsCount());
        }
        if (!context.skipExtensions().isEmpty() || !context.exclude().isEmpty()) {
            log.info("Number of link exclude : {}", report.excludedCount());
        }
        report.responseCodes().forEach((code, count) -> log.info("Nb Code HTTP {} : {}", code, count));
        report.markedUrls().forEach((code, urls) -> {
            log.info("Link with status {}:", code);
            urls.forEach(url -> log.info("\t- {}", url));
        });
    }

    private void writeFailures(List<String> failures) {
        String failuresFile = properties.getCli().getFailuresFile();
        if (failuresFile == null || failuresFile.isBlank()) {
            return;
        }
        try {
            Files.write(Path.of(failuresFile.trim()), failures, StandardCharsets.UTF_8);
            log.info("Failure summary written to {}", failuresFile);
        } catch (IOException e) {
            log.error("Could not write failure summary to {}: {}", failuresFile, e.getMessage());
        }
    }
}
