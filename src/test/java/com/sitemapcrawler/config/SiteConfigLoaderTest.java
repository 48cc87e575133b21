package com.sitemapcrawler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SiteConfigLoaderTest {
    private final SiteConfigLoader loader = new SiteConfigLoader(
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
    );

    @TempDir
    Path tempDir;

    @Test
    void readsSnakeCaseBatchFile() throws Exception {
        Path file = tempDir.resolve("sites.json");
        Files.writeString(file, """
            [
              {
                "domain": "https://example.com",
                "num_workers": 4,
                "parserobots": true,
                "output": "example.xml",
                "as_index": true,
                "skipext": ["pdf", "zip"],
                "exclude": ["/private"],
                "sitemap_url": ["https://example.com/sitemap.xml"],
                "max_url_diff": 25,
                "domain_aliases": ["www.example.com"],
                "comment": "ignored"
              },
              {
                "domain": "https://other.org",
                "sitemap_url": "https://other.org/sitemap_index.xml",
                "sitemap_only": true,
                "images": true
              }
            ]
            """);

        List<CrawlerProperties.Site> sites = loader.load(file);

        assertThat(sites).hasSize(2);
        CrawlerProperties.Site first = sites.get(0);
        assertThat(first.getDomain()).isEqualTo("https://example.com");
        assertThat(first.getNumWorkers()).isEqualTo(4);
        assertThat(first.isParseRobots()).isTrue();
        assertThat(first.getOutput()).isEqualTo("example.xml");
        assertThat(first.isAsIndex()).isTrue();
        assertThat(first.getSkipExt()).containsExactly("pdf", "zip");
        assertThat(first.getExclude()).containsExactly("/private");
        assertThat(first.getSitemapUrls()).containsExactly("https://example.com/sitemap.xml");
        assertThat(first.getMaxUrlDiff()).isEqualTo(25);
        assertThat(first.getDomainAliases()).containsExactly("www.example.com");
        assertThat(first.isRejectEmpty()).isTrue();

        CrawlerProperties.Site second = sites.get(1);
        assertThat(second.getSitemapUrls()).containsExactly("https://other.org/sitemap_index.xml");
        assertThat(second.isSitemapOnly()).isTrue();
        assertThat(second.isImages()).isTrue();
        assertThat(second.getNumWorkers()).isEqualTo(1);
    }

    @Test
    void missingOrMalformedFileYieldsNoSites() throws Exception {
        assertThat(loader.load(tempDir.resolve("absent.json"))).isEmpty();

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        assertThat(loader.load(broken)).isEmpty();

        assertThat(loader.load(null)).isEmpty();
    }
}
