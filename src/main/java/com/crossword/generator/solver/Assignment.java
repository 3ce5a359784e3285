package com.crossword.generator.solver;

import com.crossword.generator.model.Overlap;
import com.crossword.generator.model.PuzzleModel;
import com.crossword.generator.model.Variable;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Partial mapping of variables to words, built up and torn down by the search.
 * A reverse index keeps the "no word used twice" check cheap.
 */
public class Assignment {

    private final Map<Variable, String> words = new LinkedHashMap<>();
    private final Map<String, Integer> usage = new HashMap<>();

    public void assign(Variable variable, String word) {
        String previous = words.put(variable, word);
        if (previous != null) {
            release(previous);
        }
        usage.merge(word, 1, Integer::sum);
    }

    public void unassign(Variable variable) {
        String word = words.remove(variable);
        if (word != null) {
            release(word);
        }
    }

    private void release(String word) {
        usage.computeIfPresent(word, (w, count) -> count > 1 ? count - 1 : null);
    }

    public boolean isAssigned(Variable variable) {
        return words.containsKey(variable);
    }

    public Optional<String> get(Variable variable) {
        return Optional.ofNullable(words.get(variable));
    }

    public int size() {
        return words.size();
    }

    /**
     * True if every variable of {@code model} has a word.
     */
    public boolean isComplete(PuzzleModel model) {
        return words.keySet().containsAll(model.variables());
    }

    /**
     * True if some variable other than {@code variable} already holds {@code word}.
     */
    public boolean isUsedElsewhere(String word, Variable variable) {
        int count = usage.getOrDefault(word, 0);
        int own = word.equals(words.get(variable)) ? 1 : 0;
        return count > own;
    }

    /**
     * Checks the constraints touching {@code variable}, assuming the rest of the
     * assignment was already consistent: the word is unique, has the right
     * length and agrees with every assigned neighbour.
     */
    public boolean isConsistent(Variable variable, PuzzleModel model) {
        String word = words.get(variable);
        if (word == null) {
            return true;
        }
        if (word.length() != variable.getLength() || isUsedElsewhere(word, variable)) {
            return false;
        }
        for (Variable neighbor : model.neighbors(variable)) {
            String other = words.get(neighbor);
            if (other == null) {
                continue;
            }
            Optional<Overlap> overlap = model.overlap(variable, neighbor);
            if (overlap.isPresent() && !overlap.get().agrees(word, other)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks every constraint of the whole assignment.
     */
    public boolean isConsistent(PuzzleModel model) {
        if (usage.size() != words.size()) {
            return false;
        }
        for (Variable variable : words.keySet()) {
            if (!isConsistent(variable, model)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Unmodifiable copy of the current mapping.
     */
    public Map<Variable, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(words));
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
