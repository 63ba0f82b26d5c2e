package com.dflow.diagram.description;

/**
 * Explicit per-node policy override. Any field may be null; null fields fall back to compiler defaults.
 *
 * @param join          ALL, ANY or K_OF_N
 * @param k             required for K_OF_N
 * @param concurrency   SINGLETON, PER_TOKEN or BOUNDED
 * @param maxConcurrent required for BOUNDED
 */
public record PolicyDescription(String join, Integer k, String concurrency, Integer maxConcurrent) {

    public static PolicyDescription join(String join) {
        return new PolicyDescription(join, null, null, null);
    }

    public static PolicyDescription kOfN(int k) {
        return new PolicyDescription("K_OF_N", k, null, null);
    }

    public static PolicyDescription concurrency(String concurrency, Integer maxConcurrent) {
        return new PolicyDescription(null, null, concurrency, maxConcurrent);
    }
}
