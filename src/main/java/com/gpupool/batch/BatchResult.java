package com.gpupool.batch;

import com.gpupool.core.ValidationResult;
import com.gpupool.exception.BatchPartialFailureException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Outcome of a batch submission, indexed like the submitted list.
 * Every index holds either a result or a failure.
 */
public final class BatchResult {

    private final List<ValidationResult> resultsByIndex;
    private final Map<Integer, Throwable> failures;

    BatchResult(List<ValidationResult> resultsByIndex, Map<Integer, Throwable> failures) {
        this.resultsByIndex = Collections.unmodifiableList(new ArrayList<>(resultsByIndex));
        this.failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    /**
     * Successful results in input order; failed entries are skipped.
     */
    public List<ValidationResult> results() {
        List<ValidationResult> results = new ArrayList<>();
        for (ValidationResult result : resultsByIndex) {
            if (result != null) {
                results.add(result);
            }
        }
        return results;
    }

    public Optional<ValidationResult> result(int index) {
        return Optional.ofNullable(resultsByIndex.get(index));
    }

    /**
     * Failures keyed by input index, in ascending order.
     */
    public Map<Integer, Throwable> failures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int size() {
        return resultsByIndex.size();
    }

    /**
     * @throws BatchPartialFailureException listing the failed indices, if any entry failed
     */
    public BatchResult throwIfFailed() {
        if (hasFailures()) {
            throw new BatchPartialFailureException(
                    failures.size() + " of " + size() + " batch entries failed at indices", failures);
        }
        return this;
    }
}
