package com.sitemapcrawler.crawl.service;

import com.sitemapcrawler.config.CrawlerProperties;
import com.sitemapcrawler.crawl.CrawlFixtures;
import com.sitemapcrawler.crawl.extract.ContentClassifier;
import com.sitemapcrawler.crawl.extract.LinkScreener;
import com.sitemapcrawler.crawl.extract.SitemapDocumentParser;
import com.sitemapcrawler.crawl.fetch.PageFetcher;
import com.sitemapcrawler.crawl.http.PoliteHttpClient;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.CrawlOutcome;
import com.sitemapcrawler.crawl.model.CrawlPhase;
import com.sitemapcrawler.crawl.model.HttpFetchResult;
import com.sitemapcrawler.crawl.model.SitemapEntry;
import com.sitemapcrawler.crawl.model.SitemapWriteResult;
import com.sitemapcrawler.crawl.robots.RobotsTxtService;
import com.sitemapcrawler.crawl.sitemap.ExistingSitemapCounter;
import com.sitemapcrawler.crawl.sitemap.SitemapWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlOrchestratorServiceTest {

    @Mock private PoliteHttpClient httpClient;
    @TempDir Path tempDir;

    private final Map<String, HttpFetchResult> responses = new ConcurrentHashMap<>();
    private CrawlOrchestratorService service;

    @BeforeEach
    void setUp() {
        when(httpClient.get(anyString(), anyString(), anyBoolean())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            return responses.getOrDefault(url, CrawlFixtures.status(url, 404));
        });
        PageProcessor processor = new PageProcessor(
            new PageFetcher(httpClient, new ContentClassifier(new SitemapDocumentParser())),
            new LinkScreener()
        );
        service = new CrawlOrchestratorService(
            new RobotsTxtService(httpClient),
            processor,
            new SitemapWriter(new ExistingSitemapCounter())
        );
    }

    @Test
    void followsSameHostLinksAndDiscardsForeignOnes() throws Exception {
        page("http://example.com/", "<a href=\"/about\">About</a> <a href=\"https://other.com/x\">ext</a>");
        page("http://example.com/about", "<p>about</p>");
        CrawlContext context = context(site());

        CrawlRun run = service.newRun(context);
        CrawlOutcome outcome = service.run(run);

        assertThat(locations(run)).containsExactlyInAnyOrder("http://example.com/", "http://example.com/about");
        verify(httpClient, never()).get(eq("https://other.com/x"), anyString(), anyBoolean());
        assertThat(run.phase()).isEqualTo(CrawlPhase.DONE);
        assertThat(run.frontier().isDisjoint()).isTrue();
        assertThat(outcome.writeResult()).isInstanceOf(SitemapWriteResult.Written.class);
        String written = Files.readString(tempDir.resolve("sitemap.xml"), StandardCharsets.UTF_8);
        assertThat(written)
            .contains("<url><loc>http://example.com/</loc></url>")
            .contains("<url><loc>http://example.com/about</loc></url>")
            .doesNotContain("other.com");
    }

    @Test
    void sitemapIndexChildrenBypassExclusionButTheirUrlsDoNot() {
        responses.put(
            "http://example.com/sitemap_index.xml",
            CrawlFixtures.xml(
                    "http://example.com/sitemap_index.xml",
                    CrawlFixtures.sitemapIndex(
                            "http://example.com/private/sitemap-a.xml", "http://example.com/sitemap-b.xml")));
        responses.put(
            "http://example.com/private/sitemap-a.xml",
            CrawlFixtures.xml(
                    "http://example.com/private/sitemap-a.xml",
                    CrawlFixtures.urlset("http://example.com/public/a1", "http://example.com/private/a2")));
        responses.put(
            "http://example.com/sitemap-b.xml",
            CrawlFixtures.xml(
                    "http://example.com/sitemap-b.xml",
                    CrawlFixtures.urlset("http://example.com/b1", "http://example.com/private/b2")));
        CrawlerProperties.Site site = site();
        site.setSitemapUrls(List.of("http://example.com/sitemap_index.xml"));
        site.setSitemapOnly(true);
        site.setExclude(List.of("/private"));

        CrawlRun run = service.newRun(context(site));
        CrawlOutcome outcome = service.run(run);

        verify(httpClient).get(eq("http://example.com/private/sitemap-a.xml"), anyString(), anyBoolean());
        verify(httpClient, never()).get(eq("http://example.com/"), anyString(), anyBoolean());
        assertThat(locations(run)).containsExactlyInAnyOrder("http://example.com/public/a1", "http://example.com/b1");
        assertThat(outcome.report().excludedCount()).isEqualTo(2);
        assertThat(run.frontier().isDisjoint()).isTrue();
    }

    @Test
    void nestedSitemapIndexesStopAtConfiguredDepth() {
        for (int i = 0; i < 6; i++) {
            String url = "http://example.com/sitemap" + i + ".xml";
            responses.put(url, CrawlFixtures.xml(url, CrawlFixtures.sitemapIndex(
                "http://example.com/sitemap" + (i + 1) + ".xml",
                "http://example.com/leaf" + i + ".xml"
            )));
            String leaf = "http://example.com/leaf" + i + ".xml";
            responses.put(leaf, CrawlFixtures.xml(leaf, CrawlFixtures.urlset("http://example.com/page" + i)));
        }
        CrawlerProperties.Site site = site();
        site.setSitemapUrls(List.of("http://example.com/sitemap0.xml"));
        site.setSitemapOnly(true);
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxSitemapDepth(2);

        CrawlRun run = service.newRun(CrawlContext.from(site, properties));
        service.run(run);

        verify(httpClient).get(eq("http://example.com/sitemap2.xml"), anyString(), anyBoolean());
        verify(httpClient, never()).get(eq("http://example.com/sitemap3.xml"), anyString(), anyBoolean());
        verify(httpClient, never()).get(eq("http://example.com/leaf2.xml"), anyString(), anyBoolean());
        assertThat(locations(run)).containsExactlyInAnyOrder("http://example.com/page0", "http://example.com/page1");
        assertThat(run.frontier().isEmpty()).isTrue();
    }

    @Test
    void sitemapUrlsAreNotFetchedAgain() {
        responses.put(
            "http://example.com/sitemap.xml",
            CrawlFixtures.xml("http://example.com/sitemap.xml", CrawlFixtures.urlset("http://example.com/listed")));
        page("http://example.com/", "<a href=\"/listed\">listed</a>");
        CrawlerProperties.Site site = site();
        site.setSitemapUrls(List.of("http://example.com/sitemap.xml"));

        CrawlRun run = service.newRun(context(site));
        service.run(run);

        verify(httpClient, never()).get(eq("http://example.com/listed"), anyString(), anyBoolean());
        assertThat(locations(run)).containsExactlyInAnyOrder("http://example.com/", "http://example.com/listed");
    }

    @Test
    void redirectToAnotherHostDropsThePage() {
        page("http://example.com/", "<a href=\"/page\">page</a>");
        responses.put(
            "http://example.com/page",
            CrawlFixtures.redirected(
                    "http://example.com/page",
                    "https://cdn.example.com/page",
                    "text/html",
                    "<a href=\"/leak\">leak</a>"));

        CrawlRun run = service.newRun(context(site()));
        service.run(run);

        assertThat(locations(run)).containsExactly("http://example.com/");
        verify(httpClient, never()).get(eq("http://example.com/leak"), anyString(), anyBoolean());
    }

    @Test
    void anchorToCurrentPageIsNotCrawledTwice() {
        page("http://example.com/", "<a href=\"/docs\">docs</a>");
        page("http://example.com/docs", "<a href=\"#section\">jump</a>");

        CrawlRun run = service.newRun(context(site()));
        service.run(run);

        verify(httpClient, times(1)).get(eq("http://example.com/docs"), anyString(), anyBoolean());
        assertThat(locations(run)).containsExactlyInAnyOrder("http://example.com/", "http://example.com/docs");
    }

    @Test
    void binaryLinksAreListedWithoutDownload() {
        page("http://example.com/", "<a href=\"/files/report.pdf\">report</a>");

        CrawlRun run = service.newRun(context(site()));
        service.run(run);

        verify(httpClient, never()).get(eq("http://example.com/files/report.pdf"), anyString(), anyBoolean());
        assertThat(locations(run)).contains("http://example.com/files/report.pdf");
    }

    @Test
    void multipleWorkersFetchEveryPageOnce() {
        StringBuilder root = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            root.append("<a href=\"/p").append(i).append("\">p</a>");
            page(
                "http://example.com/p" + i,
                "<a href=\"/\">home</a><a href=\"/p" + ((i + 1) % 20) + "\">next</a><a href=\"/deep" + i + "\">deep</a>");
            page("http://example.com/deep" + i, "<a href=\"/p0\">p0</a>");
        }
        page("http://example.com/", root.toString());
        CrawlerProperties.Site site = site();
        site.setNumWorkers(4);

        CrawlRun run = service.newRun(context(site));
        CrawlOutcome outcome = service.run(run);

        assertThat(locations(run)).hasSize(41);
        for (int i = 0; i < 20; i++) {
            verify(httpClient, times(1)).get(eq("http://example.com/p" + i), anyString(), anyBoolean());
            verify(httpClient, times(1)).get(eq("http://example.com/deep" + i), anyString(), anyBoolean());
        }
        assertThat(run.frontier().isDisjoint()).isTrue();
        assertThat(run.frontier().isEmpty()).isTrue();
        assertThat(outcome.report().crawledCount()).isEqualTo(41);
    }

    @Test
    void sitemapOnlyWithoutSitemapFallsBackToDomainRoot() {
        page("http://example.com/", "<p>home</p>");
        CrawlerProperties.Site site = site();
        site.setSitemapOnly(true);

        CrawlRun run = service.newRun(context(site));
        service.run(run);

        assertThat(locations(run)).containsExactly("http://example.com/");
    }

    @Test
    void robotsBlockedLinksAreCountedAndSkipped() {
        responses.put(
            "http://example.com/robots.txt",
            CrawlFixtures.fetch(
                    "http://example.com/robots.txt",
                    "http://example.com/robots.txt",
                    200,
                    "text/plain",
                    "User-agent: *\nDisallow: /secret\n"));
        page("http://example.com/", "<a href=\"/secret/a\">s</a><a href=\"/open\">o</a>");
        page("http://example.com/open", "");
        CrawlerProperties.Site site = site();
        site.setParseRobots(true);

        CrawlRun run = service.newRun(context(site));
        CrawlOutcome outcome = service.run(run);

        verify(httpClient, never()).get(eq("http://example.com/secret/a"), anyString(), anyBoolean());
        assertThat(outcome.report().blockedByRobotsCount()).isEqualTo(1);
        assertThat(run.frontier().isExcluded("http://example.com/secret/a")).isTrue();
    }

    @Test
    void failingUrlsAreCountedAndMarkedWhenReporting() {
        page("http://example.com/", "<a href=\"/missing\">gone</a>");
        CrawlerProperties.Site site = site();
        site.setReport(true);

        CrawlOutcome outcome = service.run(context(site));

        assertThat(outcome.report().responseCodes()).containsEntry(200, 1).containsEntry(404, 1);
        assertThat(outcome.report().markedUrls().get(404)).containsExactly("http://example.com/missing");
        assertThat(outcome.report().entryCount()).isEqualTo(1);
        assertThat(outcome.report().discoveredCount()).isEqualTo(2);
    }

    @Test
    void imagesAreAttachedToTheirPage() throws Exception {
        page(
            "http://example.com/",
            "<img src=\"/img/logo.png\"><img src=\"https://cdn.other.com/x.png\"><a href=\"/logo.png\">logo</a>");
        CrawlerProperties.Site site = site();
        site.setImages(true);

        CrawlRun run = service.newRun(context(site));
        service.run(run);

        SitemapEntry home = run.entries().get(0);
        assertThat(home.images()).containsExactly("http://example.com/img/logo.png");
        assertThat(Files.readString(tempDir.resolve("sitemap.xml")))
            .contains("<image:image><image:loc>http://example.com/img/logo.png</image:loc></image:image>");
        verify(httpClient, never()).get(eq("http://example.com/logo.png"), anyString(), anyBoolean());
    }

    private void page(String url, String body) {
        responses.put(url, CrawlFixtures.html(url, body));
    }

    private CrawlerProperties.Site site() {
        CrawlerProperties.Site site = CrawlFixtures.site("http://example.com/");
        site.setOutput(tempDir.resolve("sitemap.xml").toString());
        return site;
    }

    private CrawlContext context(CrawlerProperties.Site site) {
        return CrawlFixtures.context(site);
    }

    private List<String> locations(CrawlRun run) {
        return run.entries().stream().map(SitemapEntry::location).toList();
    }
}
