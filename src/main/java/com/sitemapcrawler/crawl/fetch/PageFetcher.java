package com.sitemapcrawler.crawl.fetch;

import com.sitemapcrawler.crawl.extract.ContentClassifier;
import com.sitemapcrawler.crawl.http.PoliteHttpClient;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.HttpFetchResult;
import com.sitemapcrawler.crawl.model.ResponseClassification;
import com.sitemapcrawler.crawl.util.ResourceTypes;
import com.sitemapcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    private static final String ACCEPT =
        "text/html,application/xhtml+xml,application/xml;q=0.9,text/xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;
    private final ContentClassifier classifier;

    public PageFetcher(PoliteHttpClient httpClient, ContentClassifier classifier) {
        this.httpClient = httpClient;
        this.classifier = classifier;
    }

    /**
     * Fetches and classifies one frontier URL. URLs naming a binary resource are not downloaded
     * and come back as {@link ResponseClassification.Unfetched}.
     */
    public ResponseClassification fetch(String url, CrawlContext context, ResponseListener listener) {
        if (ResourceTypes.hasNotParseableExtension(UrlNormalizer.pathOf(url), context.notParseableExtensions())) {
            log.debug("Ignore {} content might be not parseable", url);
            return new ResponseClassification.Unfetched(url, "not-parseable");
        }

        HttpFetchResult fetch = httpClient.get(url, ACCEPT, context.auth());
        if (fetch.errorCode() != null) {
            log.debug("fetch failed url={} errorCode={} errorMessage={}", url, fetch.errorCode(), fetch.errorMessage());
        } else {
            listener.onResponse(url, fetch.statusCode());
            warnOnBotChallenge(url, fetch.bodyBytes());
        }
        return classifier.classify(url, fetch, context);
    }

    private void warnOnBotChallenge(String url, byte[] body) {
        if (body == null || body.length == 0) {
            return;
        }
        String text = new String(body, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
        if (text.contains("anubis")) {
            log.warn("'anubis' detected in response from {}", url);
        }
    }
}
