package com.lf2x.remote.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lf2x.config.FlowExportLoader;
import com.lf2x.config.Lf2xSettings;
import com.lf2x.core.FlowDocument;
import com.lf2x.core.IntermediateRepresentation;
import com.lf2x.core.IrBuilder;
import com.lf2x.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads flow exports from a flow server's REST API.
 *
 * <pre>
 * GET {base}/api/v1/flows/{id}
 * GET {base}/api/v1/flows?limit=..&amp;offset=..&amp;tags=a,b
 * </pre>
 *
 * Transport failures are retried up to {@code retries} times; error statuses are not.
 */
public final class FlowApiClient {
    private static final Logger log = LoggerFactory.getLogger(FlowApiClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String API_PREFIX = "/api/v1/flows";
    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;
    public static final int DEFAULT_PAGE_SIZE = 50;

    private final String baseUrl;
    private final String token;
    private final int timeoutMillis;
    private final int retries;
    private final HttpClient client;

    private FlowApiClient(Builder b) {
        String url = Objects.requireNonNull(b.baseUrl, "baseUrl");
        while (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        this.baseUrl = url;
        this.token = b.token;
        this.timeoutMillis = b.timeoutMillis;
        this.retries = b.retries;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMillis))
                .build();
    }

    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /** Client for {@code settings.apiBaseUrl()} using {@code settings.apiToken()}. */
    public static FlowApiClient fromSettings(Lf2xSettings settings) {
        Objects.requireNonNull(settings, "settings");
        if (settings.apiBaseUrl() == null || settings.apiBaseUrl().isBlank()) {
            throw new IllegalArgumentException("api.base_url must be configured to use the flow API client");
        }
        return builder(settings.apiBaseUrl()).token(settings.apiToken()).build();
    }

    public String baseUrl() { return baseUrl; }

    /** Raw export JSON of one flow. */
    public JsonNode fetchFlowJson(String flowId) throws IOException {
        Objects.requireNonNull(flowId, "flowId");
        String url = baseUrl + API_PREFIX + "/" + URLEncoder.encode(flowId, StandardCharsets.UTF_8).replace("+", "%20");
        HttpResponse<String> response = get(url);
        if (response.statusCode() == 404) throw new FlowNotFoundException(flowId);
        checkStatus(response);

        JsonNode payload = parse(response.body());
        if (!payload.isObject()) throw new FlowApiException("Unexpected response payload from flow API");
        return payload;
    }

    /** Fetches and parses one flow; the document's source path is {@code <flowId>.json}. */
    public FlowDocument fetchFlowDocument(String flowId, Lf2xSettings settings) throws IOException {
        JsonNode payload = fetchFlowJson(flowId);
        return FlowExportLoader.fromTree(
            payload, Path.of(flowId + ".json"), settings, FlowExportLoader.SUPPORTED_VERSIONS);
    }

    public IntermediateRepresentation fetchIr(String flowId, Lf2xSettings settings) throws IOException {
        return IrBuilder.build(fetchFlowDocument(flowId, settings));
    }

    /** One page of the flow listing. {@code tags} may be empty. */
    public FlowPage listFlows(int limit, int offset, List<String> tags) throws IOException {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
        if (offset < 0) throw new IllegalArgumentException("offset must not be negative: " + offset);
        Objects.requireNonNull(tags, "tags");

        StringBuilder url = new StringBuilder(baseUrl).append(API_PREFIX)
                .append("?limit=").append(limit)
                .append("&offset=").append(offset);
        if (!tags.isEmpty()) {
            url.append("&tags=").append(URLEncoder.encode(String.join(",", tags), StandardCharsets.UTF_8));
        }
        HttpResponse<String> response = get(url.toString());
        checkStatus(response);

        JsonNode payload = parse(response.body());
        if (!payload.isObject()) throw new FlowApiException("Unexpected response payload for flow listing");
        JsonNode items = payload.get("data");
        if (items == null || !items.isArray()) throw new FlowApiException("Flow listing response missing 'data' array");

        List<FlowSummary> flows = new ArrayList<>(items.size());
        for (JsonNode item : items) flows.add(FlowSummary.fromJson(item));

        JsonNode pagination = payload.get("pagination");
        if (pagination != null && pagination.isObject()) {
            return new FlowPage(
                flows,
                pagination.path("total").asInt(flows.size()),
                pagination.path("offset").asInt(offset),
                pagination.path("limit").asInt(limit));
        }
        return new FlowPage(flows, flows.size(), offset, limit);
    }

    /** Every flow summary, following pagination until the server reports no more. */
    public List<FlowSummary> flowSummaries(int pageSize, List<String> tags) throws IOException {
        List<FlowSummary> all = new ArrayList<>();
        int offset = 0;
        while (true) {
            FlowPage page = listFlows(pageSize, offset, tags);
            if (page.flows().isEmpty()) break;
            all.addAll(page.flows());
            offset = page.offset() + page.flows().size();
            if (offset >= page.total()) break;
        }
        log.debug("listed {} flow(s) from {}", all.size(), baseUrl);
        return all;
    }

    public List<FlowDocument> flowDocuments(int pageSize, List<String> tags, Lf2xSettings settings) throws IOException {
        List<FlowDocument> documents = new ArrayList<>();
        for (FlowSummary summary : flowSummaries(pageSize, tags)) {
            documents.add(fetchFlowDocument(summary.flowId(), settings));
        }
        return documents;
    }

    private HttpResponse<String> get(String url) throws IOException {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofMillis(timeoutMillis))
                .header("Accept", "application/json")
                .GET();
        if (token != null && !token.isEmpty()) b.header("Authorization", "Bearer " + token);
        HttpRequest request = b.build();

        int attempts = 0;
        while (true) {
            try {
                HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
                Metrics.recorder().onRemoteRequest(response.statusCode());
                log.debug("GET {} -> {}", url, response.statusCode());
                return response;
            } catch (IOException e) {
                attempts++;
                if (attempts > retries) throw e;
                log.warn("GET {} failed (attempt {}/{}): {}", url, attempts, retries + 1, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while requesting " + url, e);
            }
        }
    }

    private static void checkStatus(HttpResponse<String> response) throws FlowApiException {
        int code = response.statusCode();
        if (code == 401 || code == 403) throw new FlowApiAuthException(code);
        if (code >= 400) {
            throw new FlowApiException("Flow API request failed with status " + code + ": " + response.body(), code);
        }
    }

    private static JsonNode parse(String body) throws FlowApiException {
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FlowApiException("Flow API returned invalid JSON: " + e.getOriginalMessage());
        }
    }

    public static final class Builder {
        private final String baseUrl;
        private String token;
        private int timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
        private int retries = 0;

        private Builder(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        }

        public Builder token(String token) { this.token = token; return this; }

        public Builder timeoutMillis(int millis) {
            if (millis <= 0) throw new IllegalArgumentException("timeoutMillis must be positive");
            this.timeoutMillis = millis;
            return this;
        }

        public Builder retries(int retries) {
            if (retries < 0) throw new IllegalArgumentException("retries must not be negative");
            this.retries = retries;
            return this;
        }

        public FlowApiClient build() {
            return new FlowApiClient(this);
        }
    }
}
