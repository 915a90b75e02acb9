package com.gpupool.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gpupool.config.BackendConfig;
import com.gpupool.core.MetricEstimate;
import com.gpupool.request.ParametricSweep;
import com.gpupool.request.MonteCarlo;
import com.gpupool.request.RequestKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Remote handle backed by the GPU broker's HTTP functions.
 * <p>
 * Each validation kind maps to a named function. Function URLs are derived from the
 * configured endpoint: a {@code *.modal.run} host gets the function name folded into
 * its subdomain, any other endpoint gets it appended as a path segment. Requests carry
 * a bearer token and a JSON body of the form {@code {"args": {...}}}; failed attempts are
 * retried with exponential backoff.
 */
public class HttpValidationBackend implements RemoteExecutionHandle {

    private static final Logger log = LoggerFactory.getLogger(HttpValidationBackend.class);

    static final String BATCH_FUNCTION = "batch_hypothesis_validation_endpoint";
    static final String MONTE_CARLO_FUNCTION = "monte_carlo_vectorized_endpoint";
    static final String SWEEP_FUNCTION = "parametric_sweep_endpoint";
    static final String HEALTH_PATH = "/v1/health";

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);
    private static final double CONFIDENCE_LEVEL = 0.95;
    private static final int WARMUP_ITERATIONS = 100;
    private static final long MAX_BACKOFF_MS = 30_000;
    private static final Set<RequestKind> BATCH_KINDS =
            EnumSet.of(RequestKind.PHYSICS_VALIDATION, RequestKind.BATCH_VALIDATION);

    private final BackendConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpValidationBackend(BackendConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    HttpValidationBackend(BackendConfig config, HttpClient httpClient) {
        if (config.endpoint() == null || config.endpoint().isBlank()) {
            throw new IllegalArgumentException("HTTP backend requires an endpoint");
        }
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public ValidationOutcome executeSingle(RemoteCall call) {
        RequestKind kind = call.request().kind();
        return switch (kind) {
            case PHYSICS_VALIDATION, BATCH_VALIDATION -> {
                ValidationOutcome outcome = executeBatch(kind, List.of(call)).get(0);
                if (outcome == null) {
                    throw new IllegalStateException("Backend returned no result for " + call.hypothesisId());
                }
                yield outcome;
            }
            case MONTE_CARLO -> runMonteCarlo(call);
            case PARAMETRIC_SWEEP -> runSweep(call);
        };
    }

    @Override
    public List<ValidationOutcome> executeBatch(RequestKind kind, List<RemoteCall> calls) {
        if (!supportsBatch(kind)) {
            throw new UnsupportedOperationException("Batch execution not supported for " + kind);
        }
        ObjectNode args = objectMapper.createObjectNode();
        ArrayNode hypotheses = args.putArray("hypotheses");
        for (RemoteCall call : calls) {
            ObjectNode hypothesis = hypotheses.addObject();
            hypothesis.put("id", call.hypothesisId());
            hypothesis.set("parameters",
                    objectMapper.valueToTree(HypothesisParameters.of(call.request()).toWire()));
        }
        args.put("validation_type", kind == RequestKind.PHYSICS_VALIDATION ? "quick" : "full");

        JsonNode response = post(BATCH_FUNCTION, args);
        JsonNode items = response.isArray() ? response : response.path("results");
        if (!items.isArray()) {
            throw new IllegalStateException("Batch response is not a list: " + response.getNodeType());
        }

        List<ValidationOutcome> outcomes = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            JsonNode item = items.get(i);
            outcomes.add(item == null || item.isNull() ? null : decodeBatchItem(item));
        }
        return outcomes;
    }

    @Override
    public boolean supportsBatch(RequestKind kind) {
        return BATCH_KINDS.contains(kind);
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(trimTrailingSlash(config.endpoint()) + HEALTH_PATH))
                    .timeout(HEALTH_TIMEOUT)
                    .header("Authorization", "Bearer " + apiKey())
                    .GET()
                    .build();
            return probe(request);
        } catch (RuntimeException e) {
            log.debug("Health probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean warmUp(int count) {
        ObjectNode args = objectMapper.createObjectNode();
        ArrayNode configs = args.putArray("configs");
        for (int i = 0; i < count; i++) {
            ObjectNode entry = configs.addObject();
            entry.put("hypothesis_id", "warmup-" + i);
            entry.set("parameters", objectMapper.valueToTree(HypothesisParameters.from(Map.of()).toWire()));
        }
        args.put("n_iterations", WARMUP_ITERATIONS);
        args.put("confidence_level", CONFIDENCE_LEVEL);
        try {
            post(MONTE_CARLO_FUNCTION, args);
            return true;
        } catch (RuntimeException e) {
            log.warn("Warm-up of {} instances failed: {}", count, e.getMessage());
            return false;
        }
    }

    // ==================== Kind-specific calls ====================

    private ValidationOutcome runMonteCarlo(RemoteCall call) {
        MonteCarlo request = (MonteCarlo) call.request();
        HypothesisParameters parameters = HypothesisParameters.of(request);

        ObjectNode args = objectMapper.createObjectNode();
        ObjectNode entry = args.putArray("configs").addObject();
        entry.put("hypothesis_id", call.hypothesisId());
        entry.set("parameters", objectMapper.valueToTree(parameters.toWire()));
        args.put("n_iterations", request.iterations());
        args.put("confidence_level", CONFIDENCE_LEVEL);

        JsonNode response = post(MONTE_CARLO_FUNCTION, args);
        JsonNode item = response.isArray() ? response.get(0) : response.path("results").get(0);
        if (item == null || item.isNull()) {
            throw new IllegalStateException("Monte Carlo response is empty for " + call.hypothesisId());
        }

        Map<String, MetricEstimate> metrics = decodeMetrics(item.path("metrics"));
        MetricEstimate efficiency = metrics.get("efficiency");
        MetricEstimate lcoe = metrics.get("lcoe");
        boolean physicallyValid = efficiency != null
                && efficiency.mean() >= SimulatedValidationBackend.MIN_EFFICIENCY
                && efficiency.mean() <= parameters.theoreticalMaxEfficiency();
        boolean economicallyViable = lcoe != null && lcoe.mean() <= parameters.targetLcoe();
        double lcoeStd = item.path("metrics").path("lcoe").path("std").asDouble(Double.NaN);
        return new ValidationOutcome(physicallyValid, economicallyViable,
                confidenceFrom(lcoe, lcoeStd), metrics);
    }

    private ValidationOutcome runSweep(RemoteCall call) {
        ParametricSweep request = (ParametricSweep) call.request();
        HypothesisParameters baseline = HypothesisParameters.of(request);

        ObjectNode args = objectMapper.createObjectNode();
        args.set("base_config", objectMapper.valueToTree(baseline.toWire()));
        ObjectNode sweepParams = args.putObject("sweep_params");
        ArrayNode range = sweepParams.putArray(HypothesisParameters.wireName(request.parameter()));
        range.add(request.from());
        range.add(request.to());
        args.put("n_samples_per_dim", request.steps());

        JsonNode response = post(SWEEP_FUNCTION, args);
        JsonNode optimalConfig = response.path("optimal_config");
        double optimalValue = response.path("optimal_value").asDouble(Double.NaN);
        double optimalLcoe = response.path("optimal_lcoe").asDouble(Double.NaN);

        Map<String, MetricEstimate> metrics = new LinkedHashMap<>();
        metrics.put("optimal_value", new MetricEstimate(optimalValue, optimalValue, optimalValue));
        metrics.put("optimal_lcoe", new MetricEstimate(optimalLcoe, optimalLcoe, optimalLcoe));
        double paretoSize = response.path("pareto_front").size();
        metrics.put("pareto_front_size", new MetricEstimate(paretoSize, paretoSize, paretoSize));

        boolean physicallyValid = optimalConfig.isObject() && !optimalConfig.isEmpty();
        boolean economicallyViable = optimalLcoe <= baseline.targetLcoe();
        return new ValidationOutcome(physicallyValid, economicallyViable,
                physicallyValid ? 1.0 : 0.0, metrics);
    }

    // ==================== Decoding ====================

    private ValidationOutcome decodeBatchItem(JsonNode item) {
        return new ValidationOutcome(
                item.path("physics_valid").asBoolean(false),
                item.path("economically_viable").asBoolean(false),
                item.path("confidence_score").asDouble(Double.NaN),
                decodeMetrics(item.path("metrics"))
        );
    }

    /**
     * Decode a metrics object. Intervals come either as {@code ci_95: [low, high]} or as
     * {@code ci_low}/{@code ci_high}; a metric without an interval collapses to its mean.
     */
    static Map<String, MetricEstimate> decodeMetrics(JsonNode metricsNode) {
        Map<String, MetricEstimate> metrics = new LinkedHashMap<>();
        if (!metricsNode.isObject()) {
            return metrics;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = metricsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (!node.isObject() || !node.has("mean")) {
                continue;
            }
            double mean = node.path("mean").asDouble(Double.NaN);
            double low = mean;
            double high = mean;
            JsonNode ci = node.path("ci_95");
            if (ci.isArray() && ci.size() == 2) {
                low = ci.get(0).asDouble(Double.NaN);
                high = ci.get(1).asDouble(Double.NaN);
            } else if (node.has("ci_low") && node.has("ci_high")) {
                low = node.path("ci_low").asDouble(Double.NaN);
                high = node.path("ci_high").asDouble(Double.NaN);
            }
            metrics.put(field.getKey(), new MetricEstimate(mean, low, high));
        }
        return metrics;
    }

    private static double confidenceFrom(MetricEstimate lcoe, double lcoeStd) {
        if (lcoe == null || !Double.isFinite(lcoeStd) || lcoe.mean() <= 0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - lcoeStd / lcoe.mean()));
    }

    // ==================== Transport ====================

    /**
     * POST {@code {"args": args}} to the named function, retrying with exponential backoff.
     */
    JsonNode post(String function, ObjectNode args) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("args", args);
        String url = functionUrl(function);

        RuntimeException lastError = null;
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (attempt > 0) {
                sleepBackoff(attempt - 1);
            }
            try {
                String responseBody = send(url, objectMapper.writeValueAsString(body));
                return objectMapper.readTree(responseBody);
            } catch (IOException e) {
                lastError = new IllegalStateException("Failed to call " + function + ": " + e.getMessage(), e);
            } catch (RuntimeException e) {
                lastError = e;
            }
            log.warn("Call to {} failed (attempt {}/{}): {}",
                    function, attempt + 1, config.maxRetries() + 1, lastError.getMessage());
        }
        throw lastError;
    }

    String send(String url, String body) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Authorization", "Bearer " + apiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new IllegalStateException(String.format("Backend call to %s failed with HTTP %d: %s",
                        url, response.statusCode(), response.body()));
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling " + url, e);
        }
    }

    boolean probe(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode() == 200;
        } catch (IOException e) {
            log.debug("Health probe to {} failed: {}", request.uri(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    String functionUrl(String function) {
        String endpoint = trimTrailingSlash(config.endpoint());
        String dashed = function.replace('_', '-');
        if (endpoint.contains(".modal.run")) {
            return endpoint.replace(".modal.run", "--" + dashed + ".modal.run");
        }
        return endpoint + "/" + function;
    }

    private void sleepBackoff(int attempt) {
        // Shift is bounded so the delay cannot overflow before the cap applies
        long delay = Math.min(config.retryBackoffMs() << Math.min(attempt, 16), MAX_BACKOFF_MS);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during retry backoff", e);
        }
    }

    private String apiKey() {
        return config.apiKey() == null ? "" : config.apiKey();
    }

    private static String trimTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
