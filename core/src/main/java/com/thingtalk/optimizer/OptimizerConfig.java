package com.thingtalk.optimizer;

/**
 * Tunables of the filter optimizer.
 */
public final class OptimizerConfig {

    private OptimizerConfig() {} // Utility class

    /** Upper bound on the passes of the fixed-point loop */
    public static final int DEFAULT_MAX_ITERATIONS = 10;
}
