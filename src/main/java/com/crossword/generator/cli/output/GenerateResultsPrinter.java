package com.crossword.generator.cli.output;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crossword.generator.cli.model.ValidatedGenerateOptions;
import com.crossword.generator.engine.GeneratorResult;
import com.crossword.generator.solver.SolverStats;

/**
 * Responsible only for printing CLI output for the generate command.
 * The grid itself goes to the command's standard output; everything else is logged.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public static final String NO_SOLUTION = "No solution.";

    private final PrintWriter out;

    public GenerateResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printBanner(ValidatedGenerateOptions v) {
        log.debug("=================================================");
        log.debug("Crossword Generator");
        log.debug("=================================================");
        log.debug("Structure: {}", v.getStructureFile().toAbsolutePath());
        log.debug("Words:     {}", v.getWordsFile().toAbsolutePath());
        log.debug("Output:    {}", v.getOutputFile() != null ? v.getOutputFile() : "None");
        log.debug("Timeout:   {}", v.getTimeout() != null ? v.getTimeout().toMillis() + " ms" : "None");
        log.debug("=================================================");
    }

    public void printOutcome(GeneratorResult result) {
        if (result.isSolved()) {
            out.print(result.getRenderedGrid());
        } else {
            if (result.getSolveResult() != null && result.getSolveResult().isTimedOut()) {
                log.warn("Search timed out before a solution was found");
            }
            out.println(NO_SOLUTION);
        }
        out.flush();
    }

    public void printStats(GeneratorResult result) {
        if (result.getSolveResult() == null) {
            return;
        }
        SolverStats stats = result.getSolveResult().getStats();
        log.info("");
        log.info("Solver Statistics:");
        log.info("  Slots: {}", result.getCrossword().variables().size());
        log.info("  Words: {}", result.getCrossword().vocabulary().size());
        log.info("  Values Tried: {}", stats.getValuesTried());
        log.info("  Backtracks: {}", stats.getBacktracks());
        log.info("  Revisions: {}", stats.getRevisions());
        log.info("  Elapsed: {} ms", stats.getElapsedMillis());
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
