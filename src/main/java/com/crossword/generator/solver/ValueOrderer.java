package com.crossword.generator.solver;

import com.crossword.generator.model.Overlap;
import com.crossword.generator.model.PuzzleModel;
import com.crossword.generator.model.Variable;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Least-constraining-value ordering: words that rule out the fewest candidates
 * of unassigned neighbours come first. Ties fall back to alphabetical order.
 */
public class ValueOrderer {

    private final PuzzleModel model;
    private final DomainStore store;

    public ValueOrderer(PuzzleModel model, DomainStore store) {
        this.model = model;
        this.store = store;
    }

    public List<String> order(Variable variable, Assignment assignment) {
        Map<String, Integer> ruledOut = new HashMap<>();
        for (String value : store.domain(variable)) {
            ruledOut.put(value, countRuledOut(variable, value, assignment));
        }
        return ruledOut.keySet().stream()
                .sorted(Comparator.comparing((String value) -> ruledOut.get(value))
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    /**
     * Number of words in unassigned neighbours' domains that would disagree
     * with {@code value} at the shared cell.
     */
    int countRuledOut(Variable variable, String value, Assignment assignment) {
        int count = 0;
        for (Variable neighbor : model.neighbors(variable)) {
            if (assignment.isAssigned(neighbor)) {
                continue;
            }
            Optional<Overlap> overlap = model.overlap(variable, neighbor);
            if (overlap.isEmpty()) {
                continue;
            }
            for (String other : store.domain(neighbor)) {
                if (!overlap.get().agrees(value, other)) {
                    count++;
                }
            }
        }
        return count;
    }
}
