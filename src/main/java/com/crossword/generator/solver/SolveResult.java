package com.crossword.generator.solver;

import com.crossword.generator.model.Variable;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * Outcome of a solve: either a complete assignment or the no-solution marker.
 */
@Value
@Builder
public class SolveResult {
    boolean solved;
    boolean timedOut;
    @Builder.Default
    Map<Variable, String> assignment = Map.of();
    @With
    SolverStats stats;

    public static SolveResult solved(Map<Variable, String> assignment, SolverStats stats) {
        return SolveResult.builder()
                .solved(true)
                .assignment(Map.copyOf(assignment))
                .stats(stats)
                .build();
    }

    public static SolveResult noSolution(SolverStats stats) {
        return SolveResult.builder()
                .solved(false)
                .stats(stats)
                .build();
    }

    public static SolveResult timedOut(SolverStats stats) {
        return SolveResult.builder()
                .solved(false)
                .timedOut(true)
                .stats(stats)
                .build();
    }
}
