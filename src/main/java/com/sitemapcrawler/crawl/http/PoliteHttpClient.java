package com.sitemapcrawler.crawl.http;

import com.sitemapcrawler.config.CrawlerProperties;
import com.sitemapcrawler.crawl.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PoliteHttpClient {
    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, false);
    }

    /**
     * Issues a GET following redirects. Never throws: transport problems come back as a result
     * with an {@code errorCode} and status 0.
     *
     * @param withAuth add a basic {@code Authorization} header built from {@code crawler.auth}
     */
    public HttpFetchResult get(String url, String acceptHeader, boolean withAuth) {
        int maxAttempts = 1 + properties.getRequestMaxRetries();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, acceptHeader, withAuth);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url, String acceptHeader, boolean withAuth) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, "invalid_url", "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .GET();
            if (withAuth) {
                builder.header("Authorization", basicAuthorization());
            }

            HttpResponse<InputStream> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            byte[] responseBytes;
            try (InputStream body = response.body()) {
                responseBytes = body.readNBytes(properties.getMaxBodyBytes() + 1);
            }
            if (responseBytes.length > properties.getMaxBodyBytes()) {
                return errorResult(url, "body_too_large", "Response exceeds " + properties.getMaxBodyBytes() + " bytes");
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBytes,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Content-Encoding").orElse(null),
                response.headers().firstValue("Last-Modified").orElse(null),
                response.headers().firstValue("Date").orElse(null),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return errorResult(url, "http_error", e.getMessage());
        }
    }

    private String basicAuthorization() {
        String credentials = properties.getAuth().getUsername() + ":" + properties.getAuth().getPassword();
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.US_ASCII));
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return errorCode.equals("timeout") || errorCode.equals("io_error");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        int delayMs = properties.getPerHostDelayMs();
        if (delayMs <= 0) {
            return;
        }
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(delayMs));
        }
    }

    private HttpFetchResult errorResult(String url, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            null,
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
