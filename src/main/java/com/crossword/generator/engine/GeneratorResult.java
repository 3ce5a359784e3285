package com.crossword.generator.engine;

import com.crossword.generator.model.Crossword;
import com.crossword.generator.solver.SolveResult;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a generation run. {@code success} reports whether the run completed;
 * whether the puzzle had a solution is on {@link #getSolveResult()}.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    private Crossword crossword;
    private SolveResult solveResult;
    private String renderedGrid;
    private Path outputPath;
    private List<String> warnings;

    public boolean isSolved() {
        return solveResult != null && solveResult.isSolved();
    }

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .warnings(List.of())
                .build();
    }
}
