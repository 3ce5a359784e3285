package com.crossword.generator.solver;

import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;

/**
 * Tuning knobs for a single solve.
 */
@Value
@Builder(toBuilder = true)
public class SolverConfig {

    /**
     * Wall-clock bound on the search; null means unbounded.
     */
    Duration timeout;

    @Builder.Default
    Clock clock = Clock.systemUTC();

    public static SolverConfig defaults() {
        return SolverConfig.builder().build();
    }
}
