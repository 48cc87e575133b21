package com.sitemapcrawler.crawl.sitemap;

import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.SitemapEntry;
import com.sitemapcrawler.crawl.model.SitemapWriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persists the entries of a finished crawl. Guards run before anything is opened, so a rejected
 * result leaves previous output exactly as it was.
 */
@Service
public class SitemapWriter {
    private static final Logger log = LoggerFactory.getLogger(SitemapWriter.class);
    public static final int MAX_URLS_PER_SITEMAP = 50_000;

    private final ExistingSitemapCounter existingSitemapCounter;
    private final PrintStream standardOutput;

    @Autowired
    public SitemapWriter(ExistingSitemapCounter existingSitemapCounter) {
        this(existingSitemapCounter, new PrintStream(System.out, true, StandardCharsets.UTF_8));
    }

    SitemapWriter(ExistingSitemapCounter existingSitemapCounter, PrintStream standardOutput) {
        this.existingSitemapCounter = existingSitemapCounter;
        this.standardOutput = standardOutput;
    }

    /**
     * @throws UncheckedIOException when an output file cannot be written
     */
    public SitemapWriteResult write(List<SitemapEntry> entries, CrawlContext context) {
        List<String> urlElements = new ArrayList<>(entries.size());
        for (SitemapEntry entry : entries) {
            urlElements.add(SitemapXml.urlElement(entry));
        }
        if (context.sortAlphabetically()) {
            Collections.sort(urlElements);
        }

        if (urlElements.isEmpty() && context.rejectEmpty()) {
            log.warn("Crawl of {} produced no URLs; keeping previous output", context.domain());
            return new SitemapWriteResult.EmptySitemap(context.domain());
        }

        SitemapWriteResult.DriftExceeded drift = checkDrift(urlElements.size(), context);
        if (drift != null) {
            return drift;
        }

        if (context.output() == null) {
            writeSitemap(standardOutput, urlElements);
            standardOutput.flush();
            return new SitemapWriteResult.Written(List.of(), urlElements.size());
        }
        if (urlElements.size() > MAX_URLS_PER_SITEMAP && context.asIndex()) {
            return writeIndexAndSitemaps(urlElements, context);
        }
        if (urlElements.size() > MAX_URLS_PER_SITEMAP) {
            log.warn(
                "{} URLs exceed the per-file limit of {}; enable as-index to split the output",
                urlElements.size(),
                MAX_URLS_PER_SITEMAP
            );
        }
        writeSitemapFile(context.output(), urlElements);
        return new SitemapWriteResult.Written(List.of(context.output()), urlElements.size());
    }

    private SitemapWriteResult.DriftExceeded checkDrift(int newCount, CrawlContext context) {
        Integer threshold = context.maxUrlDiff();
        Double thresholdPercent = context.maxUrlDiffPercent();
        if ((threshold == null && thresholdPercent == null) || context.output() == null) {
            return null;
        }
        Integer oldCount = existingSitemapCounter.count(context.output());
        if (oldCount == null) {
            return null;
        }

        SitemapWriteResult.DriftExceeded candidate = new SitemapWriteResult.DriftExceeded(
            context.domain(),
            oldCount,
            newCount,
            threshold,
            thresholdPercent
        );
        log.info(
            "URL count comparison old={} new={} diff={} threshold={} thresholdPercent={}",
            oldCount,
            newCount,
            candidate.diff(),
            threshold,
            thresholdPercent
        );
        boolean exceeded = (threshold != null && candidate.diff() > threshold)
            || (thresholdPercent != null && candidate.diffPercent() > thresholdPercent);
        if (exceeded) {
            log.error(
                "URL count difference ({}) exceeds threshold for {}; old sitemap had {} URLs, new would have {}. Skipping update.",
                candidate.diff(),
                context.domain(),
                oldCount,
                newCount
            );
            return candidate;
        }
        log.info("URL count difference check passed for {}", context.domain());
        return null;
    }

    private SitemapWriteResult writeIndexAndSitemaps(List<String> urlElements, CrawlContext context) {
        Path indexFile = context.output();
        String fileName = indexFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";

        int fileCount = (urlElements.size() + MAX_URLS_PER_SITEMAP - 1) / MAX_URLS_PER_SITEMAP;
        List<Path> sitemapFiles = new ArrayList<>(fileCount);
        for (int i = 0; i < fileCount; i++) {
            sitemapFiles.add(indexFile.resolveSibling(baseName + "-" + i + extension));
        }

        try (BufferedWriter writer = Files.newBufferedWriter(indexFile, StandardCharsets.UTF_8)) {
            writer.write(SitemapXml.INDEX_HEADER);
            writer.newLine();
            for (Path sitemapFile : sitemapFiles) {
                writer.write(SitemapXml.indexElement(context.baseUrl() + "/" + sitemapFile.getFileName()));
                writer.newLine();
            }
            writer.write(SitemapXml.INDEX_FOOTER);
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write sitemap index " + indexFile, e);
        }

        for (int i = 0; i < fileCount; i++) {
            int from = i * MAX_URLS_PER_SITEMAP;
            int to = Math.min(from + MAX_URLS_PER_SITEMAP, urlElements.size());
            writeSitemapFile(sitemapFiles.get(i), urlElements.subList(from, to));
        }
        log.info("Wrote sitemap index {} with {} sitemap files", indexFile, fileCount);

        List<Path> written = new ArrayList<>(fileCount + 1);
        written.add(indexFile);
        written.addAll(sitemapFiles);
        return new SitemapWriteResult.Written(written, urlElements.size());
    }

    private void writeSitemapFile(Path file, List<String> urlElements) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(SitemapXml.URLSET_HEADER);
            writer.newLine();
            for (String urlElement : urlElements) {
                writer.write(urlElement);
                writer.newLine();
            }
            writer.write(SitemapXml.URLSET_FOOTER);
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write sitemap " + file, e);
        }
        log.info("Wrote {} URLs to {}", urlElements.size(), file);
    }

    private void writeSitemap(PrintStream out, List<String> urlElements) {
        out.println(SitemapXml.URLSET_HEADER);
        for (String urlElement : urlElements) {
            out.println(urlElement);
        }
        out.println(SitemapXml.URLSET_FOOTER);
    }
}
