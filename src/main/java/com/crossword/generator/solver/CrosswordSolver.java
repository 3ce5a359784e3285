package com.crossword.generator.solver;

import com.crossword.generator.model.PuzzleModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fills a puzzle: node consistency, then global arc consistency, then
 * backtracking search. Every call to {@link #solve()} starts from a fresh
 * domain store built from the vocabulary.
 */
public class CrosswordSolver {
    private static final Logger log = LoggerFactory.getLogger(CrosswordSolver.class);

    private final PuzzleModel model;
    private final SolverConfig config;

    public CrosswordSolver(PuzzleModel model) {
        this(model, SolverConfig.defaults());
    }

    public CrosswordSolver(PuzzleModel model, SolverConfig config) {
        this.model = model;
        this.config = config;
    }

    public SolveResult solve() {
        Clock clock = config.getClock();
        Instant start = clock.instant();

        DomainStore store = DomainStore.fromVocabulary(model);
        int pruned = new NodeConsistency().enforce(store, model);
        log.debug("Node consistency pruned {} candidates over {} slots", pruned, model.variables().size());

        ArcConsistency arcConsistency = new ArcConsistency(model, store);
        if (store.hasEmptyDomain() || !arcConsistency.propagate()) {
            log.debug("Puzzle rejected before search");
            return SolveResult.noSolution(SolverStats.builder()
                    .revisions(arcConsistency.getRevisions())
                    .elapsedMillis(elapsedSince(start, clock))
                    .build());
        }
        // Pre-search pruning is never undone
        store.commit();

        BacktrackingSearch search = new BacktrackingSearch(model, store, arcConsistency, config);
        SolveResult result = search.search(new Assignment());

        SolverStats stats = result.getStats().toBuilder()
                .elapsedMillis(elapsedSince(start, clock))
                .build();
        return result.withStats(stats);
    }

    private static long elapsedSince(Instant start, Clock clock) {
        return Duration.between(start, clock.instant()).toMillis();
    }
}
