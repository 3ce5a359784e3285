package com.crossword.generator.solver;

import com.crossword.generator.model.PuzzleModel;
import com.crossword.generator.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces the unary constraint of every variable: a candidate word must
 * have exactly the variable's length.
 */
public class NodeConsistency {
    private static final Logger log = LoggerFactory.getLogger(NodeConsistency.class);

    /**
     * Removes every word whose length differs from its variable's length.
     * Running it again leaves the domains unchanged.
     *
     * @return the number of words removed across all domains
     */
    public int enforce(DomainStore store, PuzzleModel model) {
        int removed = 0;
        for (Variable variable : model.variables()) {
            int length = variable.getLength();
            removed += store.removeIf(variable, word -> word.length() != length);
            if (store.isEmpty(variable)) {
                log.debug("No word of length {} for {}", length, variable);
            }
        }
        log.debug("Node consistency removed {} candidates", removed);
        return removed;
    }
}
