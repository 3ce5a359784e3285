package com.crossword.generator.solver;

import com.crossword.generator.model.PuzzleModel;
import com.crossword.generator.model.Variable;

import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the next variable to branch on: fewest remaining values first, then
 * most neighbours, then row-major position.
 */
public class VariableSelector {

    private final PuzzleModel model;
    private final DomainStore store;
    private final Comparator<Variable> order;

    public VariableSelector(PuzzleModel model, DomainStore store) {
        this.model = model;
        this.store = store;
        this.order = Comparator
                .comparingInt((Variable v) -> store.size(v))
                .thenComparing(v -> model.neighbors(v).size(), Comparator.reverseOrder())
                .thenComparing(Variable.POSITION_ORDER);
    }

    /**
     * @return the best unassigned variable, or empty if every variable is assigned
     */
    public Optional<Variable> select(Assignment assignment) {
        return model.variables().stream()
                .filter(v -> !assignment.isAssigned(v))
                .min(order);
    }
}
