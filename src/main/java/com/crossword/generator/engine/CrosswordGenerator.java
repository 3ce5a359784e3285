package com.crossword.generator.engine;

import com.crossword.generator.model.Crossword;
import com.crossword.generator.parser.CrosswordParser;
import com.crossword.generator.parser.ParseDiagnostics;
import com.crossword.generator.render.GridRenderers;
import com.crossword.generator.render.LetterGrid;
import com.crossword.generator.render.TextGridRenderer;
import com.crossword.generator.solver.CrosswordSolver;
import com.crossword.generator.solver.SolveResult;
import com.crossword.generator.solver.SolverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Runs the whole pipeline: read the input files, fill the grid, render it.
 */
public class CrosswordGenerator {
    private static final Logger log = LoggerFactory.getLogger(CrosswordGenerator.class);

    private final GeneratorConfig config;
    private final CrosswordParser parser;

    public CrosswordGenerator(GeneratorConfig config) {
        this(config, new CrosswordParser());
    }

    public CrosswordGenerator(GeneratorConfig config, CrosswordParser parser) {
        this.config = config;
        this.parser = parser;
    }

    public GeneratorResult generate() {
        try {
            // Step 1: Read structure and vocabulary
            log.debug("Step 1: Reading puzzle input...");
            ParseDiagnostics diagnostics = new ParseDiagnostics();
            Crossword crossword = parser.parse(config.getStructureFile(), config.getWordsFile(), diagnostics);
            for (String warning : diagnostics.getWarnings()) {
                log.warn(warning);
            }

            // Step 2: Solve
            log.debug("Step 2: Solving...");
            SolverConfig solverConfig = SolverConfig.builder()
                    .timeout(config.getTimeout())
                    .build();
            SolveResult solveResult = new CrosswordSolver(crossword, solverConfig).solve();

            GeneratorResult.GeneratorResultBuilder result = GeneratorResult.builder()
                    .success(true)
                    .crossword(crossword)
                    .solveResult(solveResult)
                    .warnings(List.copyOf(diagnostics.getWarnings()));

            if (!solveResult.isSolved()) {
                return result.build();
            }

            // Step 3: Render
            log.debug("Step 3: Rendering...");
            LetterGrid grid = new LetterGrid(crossword, solveResult.getAssignment());
            result.renderedGrid(new TextGridRenderer().render(grid));
            if (config.getOutputFile() != null) {
                GridRenderers.forPath(config.getOutputFile()).write(grid, config.getOutputFile());
                log.info("Saved crossword to {}", config.getOutputFile().toAbsolutePath());
                result.outputPath(config.getOutputFile());
            }
            return result.build();

        } catch (IOException e) {
            log.error("Crossword generation failed", e);
            return GeneratorResult.failure("I/O error: " + e.getMessage());
        }
    }
}
