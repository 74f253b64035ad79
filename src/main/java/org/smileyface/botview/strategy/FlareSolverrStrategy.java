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
import java.time.Duration;
import java.util.EnumSet;

/**
 * Delegates the fetch to a FlareSolverr instance, which solves interstitial challenges in its own
 * browser and returns the resulting document. Availability is a live health check.
 */
public class FlareSolverrStrategy extends AbstractFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(FlareSolverrStrategy.class);

    private static final int HEALTH_TIMEOUT_MS = 5000;

    private final String serviceUrl;
    private final String userAgent;
    private final int maxTimeoutMs;
    private final int requestTimeoutMs;
    private final ObjectMapper mapper;

    /**
     * @param serviceUrl       v1 endpoint, e.g. http://localhost:8191/v1
     * @param maxTimeoutMs     solving budget passed to the service
     * @param requestTimeoutMs socket timeout for the call, should exceed {@code maxTimeoutMs}
     */
    public FlareSolverrStrategy(String serviceUrl, String userAgent, int maxTimeoutMs, int requestTimeoutMs,
                                Duration attemptTimeout, ObjectMapper mapper) {
        super(StrategyNames.FLARESOLVERR,
                new StrategyDescriptor(EnumSet.of(CapabilityTag.CHALLENGE_SOLVER), false, attemptTimeout));
        this.serviceUrl = serviceUrl;
        this.userAgent = userAgent;
        this.maxTimeoutMs = maxTimeoutMs;
        this.requestTimeoutMs = Math.max(0, requestTimeoutMs);
        this.mapper = mapper != null ? mapper : new ObjectMapper();
    }

    @Override
    public boolean isAvailable() {
        if (isBlank(serviceUrl)) return false;
        try {
            Connection.Response res = Jsoup.connect(healthUrl(serviceUrl))
                    .method(Connection.Method.GET)
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .timeout(HEALTH_TIMEOUT_MS)
                    .execute();
            return res.statusCode() == 200;
        } catch (IOException e) {
            log.debug("FlareSolverr health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public RawResult fetch(String url) {
        long start = System.nanoTime();
        if (isBlank(serviceUrl)) {
            return RawResult.failed(FailureKind.CONFIGURATION, "FlareSolverr not configured", 0);
        }
        try {
            ObjectNode payload = mapper.createObjectNode()
                    .put("cmd", "request.get")
                    .put("url", url)
                    .put("maxTimeout", maxTimeoutMs);
            if (!isBlank(userAgent)) {
                payload.putObject("headers").put("User-Agent", userAgent);
            }
            Connection.Response res = Jsoup.connect(serviceUrl)
                    .method(Connection.Method.POST)
                    .header("Content-Type", "application/json")
                    .requestBody(mapper.writeValueAsString(payload))
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .maxBodySize(0)
                    .timeout(requestTimeoutMs)
                    .execute();
            long elapsed = elapsedMs(start);
            JsonNode data = mapper.readTree(res.body());
            if ("ok".equals(data.path("status").asText())) {
                JsonNode solution = data.path("solution");
                String html = solution.path("response").asText("");
                int status = solution.path("status").asInt(200);
                String finalUrl = solution.path("url").asText(url);
                return RawResult.fetched(html, status, elapsed, finalUrl, false);
            }
            String message = data.path("message").asText("FlareSolverr request failed");
            return RawResult.failed(FailureKind.TRANSPORT, message, res.statusCode(), null, elapsed);
        } catch (SocketTimeoutException e) {
            return RawResult.failed(FailureKind.TRANSPORT, "FlareSolverr timeout", elapsedMs(start));
        } catch (IOException e) {
            log.error("FlareSolverr error: {}", e.getMessage());
            return RawResult.failed(FailureKind.TRANSPORT, "FlareSolverr error: " + e.getMessage(), elapsedMs(start));
        }
    }

    /** Health endpoint derived from the v1 endpoint. */
    static String healthUrl(String serviceUrl) {
        String base = AffiliateFmStrategy.trimTrailingSlash(serviceUrl);
        if (base.endsWith("/v1")) {
            return base.substring(0, base.length() - 3) + "/health";
        }
        return base + "/health";
    }
}
