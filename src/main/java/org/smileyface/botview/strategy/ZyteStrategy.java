package org.smileyface.botview.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.botview.model.CapabilityTag;
import org.smileyface.botview.model.FailureKind;
import org.smileyface.botview.model.RawResult;
import org.smileyface.botview.model.StrategyDescriptor;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.EnumSet;

/**
 * Renders the page through the Zyte extraction API (managed headless browser).
 * Gets past most anti-bot walls but is seen by origins as a regular visitor.
 */
public class ZyteStrategy extends AbstractFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(ZyteStrategy.class);

    private final String endpoint;
    private final String apiKey;
    private final int requestTimeoutMs;
    private final ObjectMapper mapper;

    public ZyteStrategy(String endpoint, String apiKey, int requestTimeoutMs, Duration attemptTimeout, ObjectMapper mapper) {
        super(StrategyNames.ZYTE,
                new StrategyDescriptor(EnumSet.of(CapabilityTag.MANAGED_RENDERING), false, attemptTimeout));
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.requestTimeoutMs = Math.max(0, requestTimeoutMs);
        this.mapper = mapper != null ? mapper : new ObjectMapper();
    }

    @Override
    public boolean isAvailable() {
        return !isBlank(apiKey) && !isBlank(endpoint);
    }

    @Override
    public RawResult fetch(String url) {
        long start = System.nanoTime();
        if (!isAvailable()) {
            return RawResult.failed(FailureKind.CONFIGURATION, "Zyte API not configured", 0);
        }
        try {
            ObjectNode payload = mapper.createObjectNode()
                    .put("url", url)
                    .put("browserHtml", true);
            String auth = Base64.getEncoder().encodeToString((apiKey + ":").getBytes(StandardCharsets.UTF_8));

            log.info("Zyte: fetching {}", url);
            Connection.Response res = Jsoup.connect(endpoint)
                    .method(Connection.Method.POST)
                    .header("Authorization", "Basic " + auth)
                    .header("Content-Type", "application/json")
                    .requestBody(mapper.writeValueAsString(payload))
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .maxBodySize(0)
                    .timeout(requestTimeoutMs)
                    .execute();
            int status = res.statusCode();
            long elapsed = elapsedMs(start);
            switch (status) {
                case 200 -> {
                    return parseExtraction(url, res.body(), elapsed);
                }
                case 401 -> {
                    log.error("Zyte: Invalid API key");
                    return RawResult.failed(FailureKind.TRANSPORT, "Zyte API: Invalid API key", status, null, elapsed);
                }
                case 422 -> {
                    log.error("Zyte validation error: {}", res.body());
                    return RawResult.failed(FailureKind.TRANSPORT, "Zyte API validation error: " + res.body(), status, null, elapsed);
                }
                case 520 -> {
                    log.warn("Zyte: target error for {}", url);
                    return RawResult.failed(FailureKind.TRANSPORT, "Target website returned an error", status, null, elapsed);
                }
                default -> {
                    log.error("Zyte error: HTTP {}", status);
                    return RawResult.failed(FailureKind.TRANSPORT, "Zyte API error: HTTP " + status, status, null, elapsed);
                }
            }
        } catch (SocketTimeoutException e) {
            log.warn("Zyte timeout for {}", url);
            return RawResult.failed(FailureKind.TRANSPORT, "Zyte API timeout", elapsedMs(start));
        } catch (IOException e) {
            log.warn("Zyte error for {}: {}", url, e.getMessage());
            return RawResult.failed(FailureKind.TRANSPORT, "Zyte error: " + e.getMessage(), elapsedMs(start));
        }
    }

    private RawResult parseExtraction(String url, String body, long elapsed) throws IOException {
        JsonNode data = mapper.readTree(body);
        String html = data.path("browserHtml").asText(null);
        if (isBlank(html)) {
            String encoded = data.path("httpResponseBody").asText(null);
            if (!isBlank(encoded)) {
                try {
                    html = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
                } catch (IllegalArgumentException e) {
                    html = encoded;
                }
            }
        }
        if (isBlank(html)) {
            return RawResult.failed(FailureKind.TRANSPORT, "Zyte API returned no html", 200, null, elapsed);
        }
        int targetStatus = data.path("statusCode").asInt(200);
        String finalUrl = data.path("url").asText(url);
        log.info("Zyte: success for {}, status={}", url, targetStatus);
        return RawResult.fetched(html, targetStatus, elapsed, finalUrl, false);
    }
}
