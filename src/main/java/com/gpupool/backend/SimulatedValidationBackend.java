package com.gpupool.backend;

import com.gpupool.config.BackendConfig;
import com.gpupool.core.MetricEstimate;
import com.gpupool.request.MonteCarlo;
import com.gpupool.request.ParametricSweep;
import com.gpupool.request.RequestKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * In-process backend that runs the validation Monte Carlo locally.
 * <p>
 * Efficiency and cost are sampled from normal distributions and turned into a levelized
 * cost of energy per sample. Runs are seeded from the hypothesis id and parameters, so the
 * same call always yields the same outcome.
 */
public class SimulatedValidationBackend implements RemoteExecutionHandle {

    private static final Logger log = LoggerFactory.getLogger(SimulatedValidationBackend.class);

    static final double MIN_EFFICIENCY = 0.05;
    private static final double HOURS_PER_YEAR = 8760.0;
    private static final int MIN_SWEEP_SAMPLES = 100;
    private static final Set<RequestKind> BATCH_KINDS =
            EnumSet.of(RequestKind.PHYSICS_VALIDATION, RequestKind.BATCH_VALIDATION);

    private final long latencyMs;
    private final int iterations;

    public SimulatedValidationBackend(BackendConfig config) {
        this(config.simulatedLatencyMs(), config.simulatedIterations());
    }

    public SimulatedValidationBackend(long latencyMs, int iterations) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.latencyMs = latencyMs;
        this.iterations = iterations;
    }

    @Override
    public ValidationOutcome executeSingle(RemoteCall call) {
        simulateLatency();
        return switch (call.request().kind()) {
            case PHYSICS_VALIDATION, BATCH_VALIDATION -> validate(call, iterations);
            case MONTE_CARLO -> validate(call, ((MonteCarlo) call.request()).iterations());
            case PARAMETRIC_SWEEP -> sweep(call);
        };
    }

    @Override
    public List<ValidationOutcome> executeBatch(RequestKind kind, List<RemoteCall> calls) {
        if (!supportsBatch(kind)) {
            throw new UnsupportedOperationException("Batch execution not supported for " + kind);
        }
        simulateLatency();
        List<ValidationOutcome> outcomes = new ArrayList<>(calls.size());
        for (RemoteCall call : calls) {
            outcomes.add(validate(call, iterations));
        }
        return outcomes;
    }

    @Override
    public boolean supportsBatch(RequestKind kind) {
        return BATCH_KINDS.contains(kind);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public boolean warmUp(int count) {
        log.debug("Simulated warm-up of {} instances", count);
        return true;
    }

    private ValidationOutcome validate(RemoteCall call, int samples) {
        HypothesisParameters parameters = HypothesisParameters.of(call.request());
        Simulation simulation = simulate(parameters, samples, seedOf(call));

        Map<String, MetricEstimate> metrics = new LinkedHashMap<>();
        metrics.put("efficiency", simulation.efficiency());
        metrics.put("lcoe", simulation.lcoe());
        return new ValidationOutcome(
                simulation.physicallyValid(parameters),
                simulation.lcoeMedian() <= parameters.targetLcoe(),
                simulation.confidence(),
                metrics
        );
    }

    private ValidationOutcome sweep(RemoteCall call) {
        ParametricSweep request = (ParametricSweep) call.request();
        HypothesisParameters baseline = HypothesisParameters.of(request);
        int samplesPerPoint = Math.max(MIN_SWEEP_SAMPLES, iterations / request.steps());
        long seed = seedOf(call);

        double bestValue = Double.NaN;
        HypothesisParameters bestParameters = baseline;
        Simulation best = null;
        for (int step = 0; step < request.steps(); step++) {
            double value = request.from() + (request.to() - request.from()) * step / (request.steps() - 1);
            HypothesisParameters point = baseline.with(request.parameter(), value);
            Simulation simulation = simulate(point, samplesPerPoint, seed + step);
            if (best == null || simulation.lcoe().mean() < best.lcoe().mean()) {
                best = simulation;
                bestValue = value;
                bestParameters = point;
            }
        }

        Map<String, MetricEstimate> metrics = new LinkedHashMap<>();
        metrics.put("optimal_value", new MetricEstimate(bestValue, bestValue, bestValue));
        metrics.put("efficiency", best.efficiency());
        metrics.put("lcoe", best.lcoe());
        return new ValidationOutcome(
                best.physicallyValid(bestParameters),
                best.lcoeMedian() <= bestParameters.targetLcoe(),
                best.confidence(),
                metrics
        );
    }

    static Simulation simulate(HypothesisParameters p, int samples, long seed) {
        Random random = new Random(seed);
        double[] efficiency = new double[samples];
        double[] lcoe = new double[samples];
        double energyFactor = p.capacityKw() * p.capacityFactor() * HOURS_PER_YEAR * p.lifetimeYears();
        for (int i = 0; i < samples; i++) {
            double eff = clamp(p.efficiency() + random.nextGaussian() * p.efficiencyStd(), 0.01, 0.99);
            double cost = Math.max(1.0, p.cost() + random.nextGaussian() * p.costStd());
            efficiency[i] = eff;
            lcoe[i] = cost * 1000.0 / (energyFactor * eff);
        }
        return new Simulation(efficiency, lcoe);
    }

    private static long seedOf(RemoteCall call) {
        return Objects.hash(call.hypothesisId(), call.request().parameters());
    }

    private void simulateLatency() {
        if (latencyMs <= 0) {
            return;
        }
        try {
            Thread.sleep(latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during simulated execution", e);
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Sampled efficiency and LCOE distributions.
     */
    record Simulation(double[] efficiencySamples, double[] lcoeSamples) {

        MetricEstimate efficiency() {
            return estimate(efficiencySamples);
        }

        MetricEstimate lcoe() {
            return estimate(lcoeSamples);
        }

        double lcoeMedian() {
            return percentile(sorted(lcoeSamples), 50.0);
        }

        boolean physicallyValid(HypothesisParameters parameters) {
            double mean = mean(efficiencySamples);
            return mean >= MIN_EFFICIENCY && mean <= parameters.theoreticalMaxEfficiency();
        }

        double confidence() {
            double mean = mean(lcoeSamples);
            if (mean <= 0) {
                return 0.0;
            }
            return clamp(1.0 - std(lcoeSamples, mean) / mean, 0.0, 1.0);
        }

        private static MetricEstimate estimate(double[] samples) {
            double[] sorted = sorted(samples);
            return new MetricEstimate(mean(samples), percentile(sorted, 2.5), percentile(sorted, 97.5));
        }

        private static double[] sorted(double[] samples) {
            double[] copy = samples.clone();
            Arrays.sort(copy);
            return copy;
        }

        private static double mean(double[] samples) {
            double sum = 0;
            for (double sample : samples) {
                sum += sample;
            }
            return sum / samples.length;
        }

        private static double std(double[] samples, double mean) {
            double sum = 0;
            for (double sample : samples) {
                sum += (sample - mean) * (sample - mean);
            }
            return Math.sqrt(sum / samples.length);
        }

        // Linear interpolation between closest ranks
        private static double percentile(double[] sorted, double percent) {
            double rank = percent / 100.0 * (sorted.length - 1);
            int lower = (int) Math.floor(rank);
            int upper = (int) Math.ceil(rank);
            return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
        }
    }
}
