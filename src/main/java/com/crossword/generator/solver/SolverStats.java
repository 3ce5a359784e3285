package com.crossword.generator.solver;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a solve.
 */
@Value
@Builder(toBuilder = true)
public class SolverStats {

    long valuesTried;
    long backtracks;
    long revisions;

    long elapsedMillis;

    public static SolverStats empty() {
        return SolverStats.builder().build();
    }
}
