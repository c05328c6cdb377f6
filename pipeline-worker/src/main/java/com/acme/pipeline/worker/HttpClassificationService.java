package com.acme.pipeline.worker;

import com.acme.pipeline.core.Jsons;
import com.acme.pipeline.domain.ClassificationResult;
import com.acme.pipeline.spi.ClassificationService;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the ML classification service: {@code POST {baseUrl}/classify} with
 * {@code {"content": <base64>, "mimeType": ...}}. Every failure surfaces as
 * {@link ClassificationException}.
 */
public class HttpClassificationService implements ClassificationService {
    private static final Logger LOG = LoggerFactory.getLogger(HttpClassificationService.class);

    static final String CLASSIFY_PATH = "/classify";

    private final URI classifyUri;
    private final Duration timeout;
    private final HttpClient client;

    public HttpClassificationService(String baseUrl, Duration timeout) {
        this(baseUrl, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    HttpClassificationService(String baseUrl, Duration timeout, HttpClient client) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.classifyUri = URI.create(trimmed + CLASSIFY_PATH);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletableFuture<ClassificationResult> classify(byte[] content, String mimeType) {
        byte[] body = Jsons.toBytes(Map.of(
                "content", Base64.getEncoder().encodeToString(content),
                "mimeType", mimeType));
        HttpRequest request = HttpRequest.newBuilder(classifyUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        LOG.debug("Classifying {} bytes ({}) via {}", content.length, mimeType, classifyUri);
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        throw new ClassificationException("ML service call failed: " + cause.getMessage(), cause);
                    }
                    return toResult(response);
                });
    }

    private static ClassificationResult toResult(HttpResponse<byte[]> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ClassificationException(status, "ML service returned HTTP " + status);
        }
        try {
            ClassificationResult result = Jsons.fromBytes(response.body(), ClassificationResult.class);
            if (result == null) {
                throw new ClassificationException(status, "ML service returned an empty body");
            }
            return result;
        } catch (IOException | IllegalArgumentException e) {
            throw new ClassificationException("Unreadable ML service response: " + e.getMessage(), e);
        }
    }

    URI classifyUri() {
        return classifyUri;
    }
}
