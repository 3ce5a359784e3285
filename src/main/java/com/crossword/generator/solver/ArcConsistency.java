package com.crossword.generator.solver;

import com.crossword.generator.model.Overlap;
import com.crossword.generator.model.PuzzleModel;
import com.crossword.generator.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * AC-3 propagation of the pairwise overlap constraints.
 */
public class ArcConsistency {
    private static final Logger log = LoggerFactory.getLogger(ArcConsistency.class);

    private final PuzzleModel model;
    private final DomainStore store;

    private long revisions;

    public ArcConsistency(PuzzleModel model, DomainStore store) {
        this.model = model;
        this.store = store;
    }

    /**
     * Makes {@code x} arc consistent with {@code y}: drops every word of x that
     * has no partner in y agreeing on the shared cell. No-op if they do not cross.
     *
     * @return true if x's domain shrank
     */
    public boolean revise(Variable x, Variable y) {
        Optional<Overlap> overlap = model.overlap(x, y);
        if (overlap.isEmpty()) {
            return false;
        }
        int ix = overlap.get().getFirstIndex();
        int iy = overlap.get().getSecondIndex();

        // Letters y can still offer at the shared cell
        Set<Character> supported = new HashSet<>();
        for (String wy : store.domain(y)) {
            if (iy < wy.length()) {
                supported.add(wy.charAt(iy));
            }
        }

        int removed = store.removeIf(x, wx -> ix >= wx.length() || !supported.contains(wx.charAt(ix)));
        if (removed > 0) {
            revisions++;
            return true;
        }
        return false;
    }

    /**
     * Propagates every arc of the puzzle.
     *
     * @return false if some domain became empty
     */
    public boolean propagate() {
        return propagate(null);
    }

    /**
     * Propagates starting from {@code arcs}, or from every arc of the puzzle when
     * {@code arcs} is null. An empty list propagates nothing.
     *
     * @return false if some domain became empty
     */
    public boolean propagate(Collection<Arc> arcs) {
        Deque<Arc> queue = new ArrayDeque<>();
        if (arcs == null) {
            queue.addAll(allArcs());
        } else {
            queue.addAll(arcs);
        }

        while (!queue.isEmpty()) {
            Arc arc = queue.pollLast();
            Variable x = arc.getX();
            Variable y = arc.getY();

            if (revise(x, y)) {
                if (store.isEmpty(x)) {
                    log.debug("Domain of {} wiped out while revising against {}", x, y);
                    return false;
                }
                for (Variable z : model.neighbors(x)) {
                    if (!z.equals(y)) {
                        queue.addLast(new Arc(z, x));
                    }
                }
            }
        }
        return true;
    }

    /**
     * Arcs (neighbor, variable) for every neighbour of {@code variable}.
     */
    public List<Arc> arcsInto(Variable variable) {
        return model.neighbors(variable).stream()
                .map(neighbor -> new Arc(neighbor, variable))
                .toList();
    }

    /**
     * Number of revisions that removed at least one word since this instance was created.
     */
    public long getRevisions() {
        return revisions;
    }

    private List<Arc> allArcs() {
        // Pairs that do not cross can never be revised, so only crossing pairs are queued
        return model.variables().stream()
                .flatMap(x -> model.neighbors(x).stream().map(y -> new Arc(x, y)))
                .toList();
    }
}
