package com.gpupool.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpupool.config.BackendConfig;
import com.gpupool.config.BackendType;
import com.gpupool.core.MetricEstimate;
import com.gpupool.request.MonteCarlo;
import com.gpupool.request.ParametricSweep;
import com.gpupool.request.PhysicsValidation;
import com.gpupool.request.RequestKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpValidationBackend, with the transport replaced by scripted responses.
 */
class HttpValidationBackendTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static BackendConfig config(String endpoint, int maxRetries) {
        return new BackendConfig(BackendType.HTTP, endpoint, "secret", 1_000, maxRetries, 1, 0, 100);
    }

    /**
     * Backend whose POSTs are answered from a script: a String is a response body,
     * an IOException is thrown as a transport failure.
     */
    static class ScriptedBackend extends HttpValidationBackend {

        final Deque<Object> script = new ArrayDeque<>();
        final List<String> urls = new ArrayList<>();
        final List<JsonNode> bodies = new ArrayList<>();
        boolean healthy = true;

        ScriptedBackend(BackendConfig config) {
            super(config, HttpClient.newHttpClient());
        }

        ScriptedBackend respond(Object response) {
            script.add(response);
            return this;
        }

        @Override
        String send(String url, String body) throws IOException {
            urls.add(url);
            bodies.add(MAPPER.readTree(body));
            Object next = script.poll();
            if (next == null) {
                throw new IOException("no scripted response");
            }
            if (next instanceof IOException e) {
                throw e;
            }
            return (String) next;
        }

        @Override
        boolean probe(HttpRequest request) {
            urls.add(request.uri().toString());
            return healthy;
        }
    }

    @Test
    @DisplayName("Should fold the function name into a modal.run subdomain")
    void shouldBuildModalFunctionUrl() {
        ScriptedBackend backend = new ScriptedBackend(config("https://acme--gpu.modal.run/", 0));

        assertEquals("https://acme--gpu--batch-hypothesis-validation-endpoint.modal.run",
                backend.functionUrl(HttpValidationBackend.BATCH_FUNCTION));
    }

    @Test
    @DisplayName("Should append the function name to a plain endpoint")
    void shouldBuildPathFunctionUrl() {
        ScriptedBackend backend = new ScriptedBackend(config("https://gpu.example.com/api", 0));

        assertEquals("https://gpu.example.com/api/monte_carlo_vectorized_endpoint",
                backend.functionUrl(HttpValidationBackend.MONTE_CARLO_FUNCTION));
    }

    @Test
    @DisplayName("Should send a batch call and decode each entry in order")
    void shouldExecuteBatch() {
        ScriptedBackend backend = new ScriptedBackend(config("https://gpu.example.com", 0)).respond("""
                [
                  {"physics_valid": true, "economically_viable": false, "confidence_score": 0.8,
                   "metrics": {"lcoe": {"mean": 0.06, "ci_95": [0.05, 0.07]}}},
                  null
                ]
                """);
        List<RemoteCall> calls = List.of(
                new RemoteCall("hyp-1", new PhysicsValidation(Map.of("efficiency", 0.4))),
                new RemoteCall("hyp-2", new PhysicsValidation(Map.of("efficiency", 0.5))));

        List<ValidationOutcome> outcomes = backend.executeBatch(RequestKind.PHYSICS_VALIDATION, calls);

        assertEquals(2, outcomes.size());
        ValidationOutcome first = outcomes.get(0);
        assertTrue(first.physicallyValid());
        assertFalse(first.economicallyViable());
        assertEquals(0.8, first.confidenceScore(), 1e-9);
        assertEquals(new MetricEstimate(0.06, 0.05, 0.07), first.metrics().get("lcoe"));
        assertNull(outcomes.get(1));

        JsonNode args = backend.bodies.get(0).path("args");
        assertEquals("quick", args.path("validation_type").asText());
        assertEquals("hyp-2", args.path("hypotheses").get(1).path("id").asText());
        assertEquals(0.4, args.path("hypotheses").get(0).path("parameters").path("efficiency_mean").asDouble(), 1e-9);
        assertEquals(100.0, args.path("hypotheses").get(0).path("parameters").path("cost_mean").asDouble(), 1e-9);
    }

    @Test
    @DisplayName("Should run Monte Carlo and derive validity from the returned metrics")
    void shouldExecuteMonteCarlo() {
        ScriptedBackend backend = new ScriptedBackend(config("https://gpu.example.com", 0)).respond("""
                {"results": [{"metrics": {
                    "efficiency": {"mean": 0.35, "ci_low": 0.30, "ci_high": 0.40},
                    "lcoe": {"mean": 0.04, "std": 0.004, "ci_low": 0.035, "ci_high": 0.045}
                }}]}
                """);

        ValidationOutcome outcome = backend.executeSingle(
                new RemoteCall("hyp-mc", new MonteCarlo(Map.of("efficiency", 0.35), 5000)));

        assertTrue(outcome.physicallyValid());
        assertTrue(outcome.economicallyViable());
        assertEquals(0.9, outcome.confidenceScore(), 1e-9);
        assertEquals(new MetricEstimate(0.35, 0.30, 0.40), outcome.metrics().get("efficiency"));
        assertTrue(backend.urls.get(0).endsWith("/" + HttpValidationBackend.MONTE_CARLO_FUNCTION));
        JsonNode args = backend.bodies.get(0).path("args");
        assertEquals(5000, args.path("n_iterations").asInt());
        assertEquals("hyp-mc", args.path("configs").get(0).path("hypothesis_id").asText());
    }

    @Test
    @DisplayName("Should run a parametric sweep with the swept parameter's wire name")
    void shouldExecuteSweep() {
        ScriptedBackend backend = new ScriptedBackend(config("https://gpu.example.com", 0)).respond("""
                {"optimal_config": {"efficiency_mean": 0.42}, "optimal_value": 0.42,
                 "optimal_lcoe": 0.03, "pareto_front": [{}, {}, {}]}
                """);

        ValidationOutcome outcome = backend.executeSingle(new RemoteCall("hyp-sweep",
                new ParametricSweep("efficiency", 0.2, 0.5, 4, Map.of("cost", 80.0))));

        assertTrue(outcome.physicallyValid());
        assertTrue(outcome.economicallyViable());
        assertEquals(0.42, outcome.metrics().get("optimal_value").mean(), 1e-9);
        assertEquals(3.0, outcome.metrics().get("pareto_front_size").mean(), 1e-9);
        JsonNode args = backend.bodies.get(0).path("args");
        assertEquals(0.2, args.path("sweep_params").path("efficiency_mean").get(0).asDouble(), 1e-9);
        assertEquals(80.0, args.path("base_config").path("cost_mean").asDouble(), 1e-9);
        assertEquals(4, args.path("n_samples_per_dim").asInt());
    }

    @Test
    @DisplayName("Should retry transport failures and succeed within the retry budget")
    void shouldRetryTransportFailures() {
        ScriptedBackend backend = new ScriptedBackend(config("https://gpu.example.com", 2))
                .respond(new IOException("connection reset"))
                .respond(new IOException("connection reset"))
                .respond("[{\"physics_valid\": true, \"economically_viable\": true, \"confidence_score\": 0.7}]");

        ValidationOutcome outcome = backend.executeSingle(
                new RemoteCall("hyp-1", new PhysicsValidation(Map.of())));

        assertTrue(outcome.physicallyValid());
        assertEquals(3, backend.urls.size());
    }

    @Test
    @DisplayName("Should give up after exhausting retries")
    void shouldFailAfterRetriesExhausted() {
        ScriptedBackend backend = new ScriptedBackend(config("https://gpu.example.com", 1))
                .respond(new IOException("timeout"))
                .respond(new IOException("timeout"))
                .respond("[]");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> backend.executeSingle(
                new RemoteCall("hyp-1", new PhysicsValidation(Map.of()))));

        assertTrue(e.getMessage().contains("timeout"));
        assertEquals(2, backend.urls.size());
    }

    @Test
    @DisplayName("Should report warm-up failure instead of throwing")
    void shouldReportWarmUpFailure() {
        ScriptedBackend failing = new ScriptedBackend(config("https://gpu.example.com", 0))
                .respond(new IOException("no capacity"));
        ScriptedBackend working = new ScriptedBackend(config("https://gpu.example.com", 0))
                .respond("{\"results\": []}");

        assertFalse(failing.warmUp(2));
        assertTrue(working.warmUp(2));
        assertEquals(2, working.bodies.get(0).path("args").path("configs").size());
    }

    @Test
    @DisplayName("Should probe the health path")
    void shouldProbeHealth() {
        ScriptedBackend backend = new ScriptedBackend(config("https://gpu.example.com/", 0));

        assertTrue(backend.isAvailable());
        backend.healthy = false;
        assertFalse(backend.isAvailable());
        assertEquals("https://gpu.example.com/v1/health", backend.urls.get(0));
    }

    @Test
    @DisplayName("Should require an endpoint")
    void shouldRequireEndpoint() {
        assertThrows(IllegalArgumentException.class,
                () -> new HttpValidationBackend(config(" ", 0)));
    }

    @Test
    @DisplayName("Should decode metrics with either interval form and skip entries without a mean")
    void shouldDecodeMetrics() throws Exception {
        JsonNode node = MAPPER.readTree("""
                {"a": {"mean": 1.0, "ci_95": [0.5, 1.5]},
                 "b": {"mean": 2.0, "ci_low": 1.0, "ci_high": 3.0},
                 "c": {"mean": 3.0},
                 "d": {"std": 1.0},
                 "e": 7}
                """);

        Map<String, MetricEstimate> metrics = HttpValidationBackend.decodeMetrics(node);

        assertEquals(3, metrics.size());
        assertEquals(new MetricEstimate(1.0, 0.5, 1.5), metrics.get("a"));
        assertEquals(new MetricEstimate(2.0, 1.0, 3.0), metrics.get("b"));
        assertEquals(new MetricEstimate(3.0, 3.0, 3.0), metrics.get("c"));
    }
}
