package com.gpupool.exception;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One or more entries of a batch submission failed.
 * Failures are keyed by the index of the failing entry in the submitted list.
 */
public class BatchPartialFailureException extends PoolException {

    private final Map<Integer, Throwable> failures;

    public BatchPartialFailureException(String message, Map<Integer, Throwable> failures) {
        super(message + " " + new TreeMap<>(failures).keySet());
        this.failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    public BatchPartialFailureException(int index, String message) {
        this(message, Map.of(index, new PoolException(message)));
    }

    public Map<Integer, Throwable> getFailures() {
        return failures;
    }
}
