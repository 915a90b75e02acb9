package com.gpupool;

import com.gpupool.batch.BatchResult;
import com.gpupool.core.TaskSpec;
import com.gpupool.core.ValidationPool;
import com.gpupool.core.ValidationResult;
import com.gpupool.request.BatchValidation;
import com.gpupool.request.MonteCarlo;
import com.gpupool.request.ParametricSweep;
import com.gpupool.selection.ScoreAdjuster;
import com.gpupool.selection.TierSelector;
import com.gpupool.spring.EnableValidationPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating the GPU validation pool.
 */
@SpringBootApplication
@EnableValidationPool
public class GpuPoolApplication {

    private static final Logger log = LoggerFactory.getLogger(GpuPoolApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GpuPoolApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gpu-pool.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(ValidationPool pool) {
        return args -> {
            log.info("=== GPU Validation Pool Demo Started ===");

            // Score-driven single submissions
            double[] scores = {9.2, 7.4, 6.1};
            for (int i = 0; i < scores.length; i++) {
                TaskSpec spec = TierSelector.specFor("hyp-" + i, scores[i],
                        new MonteCarlo(Map.of("efficiency", 0.30 + i * 0.05), 2_000));
                ValidationResult result = pool.submit(spec);
                log.info("{} on {}: physics={}, viable={}, confidence={}, score {} -> {}",
                        result.hypothesisId(), result.tier(), result.physicallyValid(),
                        result.economicallyViable(), String.format("%.3f", result.confidenceScore()),
                        scores[i], String.format("%.2f", ScoreAdjuster.adjust(scores[i], result)));
            }

            // Resubmitting an identical request is answered from the cache
            ValidationResult replay = pool.submit(TierSelector.specFor("hyp-0-again", scores[0],
                    new MonteCarlo(Map.of("efficiency", 0.30), 2_000)));
            log.info("Replay served from cache: {}", replay.fromCache());

            // Batch-capable requests on one tier go out as a single bulk call
            List<TaskSpec> batch = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                batch.add(TaskSpec.of("batch-" + i, TierSelector.tierFor(7.5),
                        new BatchValidation(Map.of("efficiency", 0.25 + i * 0.02, "cost", 80.0 + i * 10))));
            }
            BatchResult batchResult = pool.submitBatch(batch);
            log.info("Batch: {} results, {} failures", batchResult.results().size(), batchResult.failures().size());

            ValidationResult sweep = pool.submit(TierSelector.specFor("sweep-0", 8.6,
                    new ParametricSweep("efficiency", 0.2, 0.5, 7, Map.of())));
            log.info("Sweep optimum: {}", sweep.metrics().get("optimal_value"));

            log.info("Metrics: {}", pool.metrics());
            log.info("Utilization: {}", pool.utilization());
            log.info("=== GPU Validation Pool Demo Finished ===");
        };
    }
}
