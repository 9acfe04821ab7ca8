package com.tariffmonitor.monitor.http;

import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.monitor.model.HttpFetchResult;
import com.tariffmonitor.monitor.util.ReasonCodeClassifier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
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
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Blocking HTTP access for document fetches, metadata probes and selector calls. Every call is
 * bounded by the request timeout and retried a fixed number of times on transient failures.
 * Failures come back as an {@link HttpFetchResult} with an error code, never as an exception.
 */
@Service
public class DocumentHttpClient {
    private static final int READ_CHUNK = 8192;

    private final MonitorProperties properties;
    private final HttpClient client;

    public DocumentHttpClient(MonitorProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader, long maxBytes) {
        return send(new RequestSpec(url, "GET", acceptHeader, null, null, Map.of(), maxBytes));
    }

    /**
     * Conditional metadata probe. Sends {@code If-Modified-Since} when a reference time is known.
     */
    public HttpFetchResult head(String url, Instant ifModifiedSince) {
        Map<String, String> headers = ifModifiedSince == null
            ? Map.of()
            : Map.of("If-Modified-Since", formatHttpDate(ifModifiedSince));
        return send(new RequestSpec(url, "HEAD", "*/*", null, null, headers, 0));
    }

    public HttpFetchResult postJson(String url, String jsonBody, Map<String, String> headers, long maxBytes) {
        return send(new RequestSpec(
            url,
            "POST",
            "application/json",
            jsonBody == null ? "" : jsonBody,
            "application/json",
            headers == null ? Map.of() : headers,
            maxBytes
        ));
    }

    private HttpFetchResult send(RequestSpec spec) {
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(spec);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(RequestSpec spec) {
        URI uri = toUri(spec.url());
        if (uri == null || uri.getHost() == null) {
            return errorResult(spec.url(), "invalid_url", "URL missing host or malformed");
        }

        try {
            String safeAccept = (spec.accept() == null || spec.accept().isBlank()) ? "*/*" : spec.accept();
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.5");
            spec.headers().forEach(builder::header);
            if ("POST".equals(spec.method())) {
                builder.header("Content-Type", spec.contentType())
                    .POST(HttpRequest.BodyPublishers.ofString(spec.body(), StandardCharsets.UTF_8));
            } else if ("HEAD".equals(spec.method())) {
                builder.method("HEAD", HttpRequest.BodyPublishers.noBody());
            } else {
                builder.GET();
            }

            HttpResponse<InputStream> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            byte[] bytes;
            try (InputStream body = response.body()) {
                if ("HEAD".equals(spec.method())) {
                    bytes = null;
                } else {
                    OptionalLong declared = response.headers().firstValueAsLong("Content-Length");
                    if (declared.isPresent() && declared.getAsLong() > spec.maxBytes()) {
                        return tooLarge(spec, declared.getAsLong());
                    }
                    bytes = readLimited(body, spec.maxBytes());
                    if (bytes == null) {
                        return tooLarge(spec, -1);
                    }
                }
            }
            return new HttpFetchResult(
                spec.url(),
                response.statusCode(),
                bytes,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Last-Modified").map(DocumentHttpClient::parseHttpDate).orElse(null),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(spec.url(), "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(spec.url(), "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(spec.url(), "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(spec.url(), "invalid_url", e.getMessage());
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        if (result.errorCode() != null) {
            String reason = ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
            return ReasonCodeClassifier.isRetryable(reason);
        }
        if (result.isSuccessful() || result.isNotModified()) {
            return false;
        }
        return ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.fromHttpStatus(result.statusCode()));
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
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private byte[] readLimited(InputStream body, long maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[READ_CHUNK];
        long total = 0;
        int read;
        while ((read = body.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                return null;
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    private HttpFetchResult tooLarge(RequestSpec spec, long declaredBytes) {
        String detail = declaredBytes >= 0
            ? "Content-Length " + declaredBytes + " exceeds limit of " + spec.maxBytes() + " bytes"
            : "Body exceeds limit of " + spec.maxBytes() + " bytes";
        return errorResult(spec.url(), "body_too_large", detail);
    }

    private HttpFetchResult errorResult(String url, String code, String message) {
        return new HttpFetchResult(url, 0, null, null, null, code, message);
    }

    private String describe(IOException e) {
        String message = e.getMessage();
        String type = e.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    static String formatHttpDate(Instant value) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(value.atZone(ZoneOffset.UTC));
    }

    static Instant parseHttpDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return DateTimeFormatter.RFC_1123_DATE_TIME.parse(value.trim(), Instant::from);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private record RequestSpec(
        String url,
        String method,
        String accept,
        String body,
        String contentType,
        Map<String, String> headers,
        long maxBytes
    ) {}
}
