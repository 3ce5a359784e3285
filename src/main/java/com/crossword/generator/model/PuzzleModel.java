package com.crossword.generator.model;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of a puzzle as consumed by the solver.
 */
public interface PuzzleModel {

    Set<Variable> variables();

    /**
     * Variables sharing a cell with {@code variable}. Never contains the variable itself.
     */
    Set<Variable> neighbors(Variable variable);

    /**
     * Character indices that must agree between {@code first} and {@code second},
     * or empty if they do not cross. Asking for a variable paired with itself yields empty.
     */
    Optional<Overlap> overlap(Variable first, Variable second);

    Set<String> vocabulary();
}
