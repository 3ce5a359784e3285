package com.crossword.generator.solver;

import com.crossword.generator.model.PuzzleModel;
import com.crossword.generator.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Depth-first search over partial assignments with AC-3 propagation after
 * every tentative assignment.
 *
 * <p>The search keeps its own stack of frames, one per assigned variable, so
 * its depth is bounded by the heap rather than the thread stack. Each frame
 * remembers the domain-store checkpoint taken before any of its values was
 * tried; undoing a value rolls the store back to it.
 */
public class BacktrackingSearch {
    private static final Logger log = LoggerFactory.getLogger(BacktrackingSearch.class);

    private final PuzzleModel model;
    private final DomainStore store;
    private final ArcConsistency arcConsistency;
    private final VariableSelector selector;
    private final ValueOrderer orderer;
    private final Duration timeout;
    private final Clock clock;

    private long valuesTried;
    private long backtracks;

    public BacktrackingSearch(PuzzleModel model, DomainStore store, ArcConsistency arcConsistency, SolverConfig config) {
        this.model = model;
        this.store = store;
        this.arcConsistency = arcConsistency;
        this.selector = new VariableSelector(model, store);
        this.orderer = new ValueOrderer(model, store);
        this.timeout = config.getTimeout();
        this.clock = config.getClock();
    }

    /**
     * Extends {@code assignment} to a complete one if possible.
     * On failure the domain store is left as it was on entry.
     */
    public SolveResult search(Assignment assignment) {
        Instant start = clock.instant();
        Instant deadline = timeout == null || timeout.isZero() ? null : start.plus(timeout);

        if (assignment.isComplete(model)) {
            return SolveResult.solved(assignment.asMap(), stats(start));
        }
        if (store.hasEmptyDomain()) {
            log.debug("Search not started: a domain is already empty");
            return SolveResult.noSolution(stats(start));
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(openFrame(assignment));

        while (!stack.isEmpty()) {
            if (deadline != null && clock.instant().isAfter(deadline)) {
                log.warn("Search abandoned after {} ms with {} of {} slots filled",
                        timeout.toMillis(), assignment.size(), model.variables().size());
                unwind(stack, assignment);
                return SolveResult.timedOut(stats(start));
            }

            Frame frame = stack.peek();
            if (frame.holding) {
                undo(frame, assignment);
            }
            if (!frame.hasNext()) {
                stack.pop();
                continue;
            }

            Variable variable = frame.variable;
            String value = frame.nextValue();
            valuesTried++;
            assignment.assign(variable, value);

            if (!assignment.isConsistent(variable, model)) {
                assignment.unassign(variable);
                continue;
            }

            store.narrowTo(variable, value);
            if (!arcConsistency.propagate(arcConsistency.arcsInto(variable))) {
                log.trace("Propagation failed after {} = {}", variable, value);
                undo(frame, assignment);
                continue;
            }
            frame.holding = true;

            if (assignment.isComplete(model)) {
                log.debug("Solution found after {} values and {} backtracks", valuesTried, backtracks);
                return SolveResult.solved(assignment.asMap(), stats(start));
            }
            stack.push(openFrame(assignment));
        }

        log.debug("Search space exhausted after {} values", valuesTried);
        return SolveResult.noSolution(stats(start));
    }

    private Frame openFrame(Assignment assignment) {
        Variable variable = selector.select(assignment)
                .orElseThrow(() -> new IllegalStateException("No unassigned variable left in an incomplete assignment"));
        List<String> values = orderer.order(variable, assignment);
        log.trace("Branching on {} with {} candidates", variable, values.size());
        return new Frame(variable, values, store.checkpoint());
    }

    private void undo(Frame frame, Assignment assignment) {
        assignment.unassign(frame.variable);
        store.rollback(frame.checkpoint);
        frame.holding = false;
        backtracks++;
    }

    private void unwind(Deque<Frame> stack, Assignment assignment) {
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.holding) {
                assignment.unassign(frame.variable);
                store.rollback(frame.checkpoint);
            }
        }
    }

    private SolverStats stats(Instant start) {
        return SolverStats.builder()
                .valuesTried(valuesTried)
                .backtracks(backtracks)
                .revisions(arcConsistency.getRevisions())
                .elapsedMillis(Duration.between(start, clock.instant()).toMillis())
                .build();
    }

    private static final class Frame {
        private final Variable variable;
        private final List<String> values;
        private final int checkpoint;
        private int next;
        private boolean holding;

        private Frame(Variable variable, List<String> values, int checkpoint) {
            this.variable = variable;
            this.values = values;
            this.checkpoint = checkpoint;
        }

        private boolean hasNext() {
            return next < values.size();
        }

        private String nextValue() {
            return values.get(next++);
        }
    }
}
