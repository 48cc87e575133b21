package com.sitemapcrawler.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a JSON batch file: an array of site objects keyed in snake_case
 * ({@code domain}, {@code num_workers}, {@code sitemap_url}, ...).
 */
@Component
public class SiteConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SiteConfigLoader.class);

    private final ObjectMapper mapper;

    public SiteConfigLoader(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public List<CrawlerProperties.Site> load(Path file) {
        if (file == null) {
            return List.of();
        }
        try {
            List<CrawlerProperties.Site> sites = mapper.readValue(
                Files.readAllBytes(file),
                new TypeReference<List<CrawlerProperties.Site>>() {
                }
            );
            log.info("Loaded {} site configs from {}", sites.size(), file);
            return sites;
        } catch (IOException e) {
            log.error("Could not read site config file {}: {}", file, e.getMessage());
            return List.of();
        }
    }
}
