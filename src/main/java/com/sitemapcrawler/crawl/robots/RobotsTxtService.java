package com.sitemapcrawler.crawl.robots;

import com.sitemapcrawler.crawl.http.PoliteHttpClient;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final PoliteHttpClient httpClient;

    public RobotsTxtService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Loads {@code scheme://host/robots.txt} once for the run. An unreachable or unparseable file
     * leaves the policy allowing everything.
     */
    public RobotsPolicy loadPolicy(CrawlContext context) {
        if (!context.parseRobots()) {
            return RobotsPolicy.disabled();
        }
        String robotsUrl = context.baseUrl() + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, "text/plain,text/*;q=0.9,*/*;q=0.1", context.auth());
        if (!fetch.isSuccessful() || fetch.bodyBytes() == null) {
            log.warn(
                "robots fetch failed url={} status={} errorCode={} errorMessage={} decision=allow_all",
                robotsUrl,
                fetch.statusCode(),
                fetch.errorCode(),
                fetch.errorMessage()
            );
            return RobotsPolicy.failOpen(context.robotsUserAgent());
        }
        try {
            RobotsRules rules = RobotsRules.parse(new String(fetch.bodyBytes(), StandardCharsets.UTF_8));
            log.debug("Loaded robots for {} user-agent={}", context.targetHost(), context.robotsUserAgent());
            return RobotsPolicy.of(rules, context.robotsUserAgent());
        } catch (RuntimeException e) {
            log.warn("robots parse failed url={} errorMessage={} decision=allow_all", robotsUrl, e.getMessage());
            return RobotsPolicy.failOpen(context.robotsUserAgent());
        }
    }
}
