package com.crossword.generator.solver;

import com.crossword.generator.model.PuzzleModel;
import com.crossword.generator.model.Variable;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Current candidate words of every variable.
 *
 * <p>Domains only shrink. Every removal is recorded on a trail so that a
 * search can take a {@link #checkpoint()} before a tentative assignment and
 * {@link #rollback(int)} to it when the branch fails.
 */
public class DomainStore {

    private final Map<Variable, Set<String>> domains = new LinkedHashMap<>();
    private final Deque<Removal> trail = new ArrayDeque<>();

    /**
     * Every variable of {@code model} starts with the full vocabulary.
     */
    public static DomainStore fromVocabulary(PuzzleModel model) {
        DomainStore store = new DomainStore();
        for (Variable variable : model.variables()) {
            store.domains.put(variable, new LinkedHashSet<>(model.vocabulary()));
        }
        return store;
    }

    /**
     * A store with explicit domains, mostly useful for tests.
     */
    public static DomainStore of(Map<Variable, ? extends Set<String>> initial) {
        DomainStore store = new DomainStore();
        initial.forEach((variable, words) -> store.domains.put(variable, new LinkedHashSet<>(words)));
        return store;
    }

    public Set<Variable> variables() {
        return Collections.unmodifiableSet(domains.keySet());
    }

    /**
     * Read-only live view of a variable's domain.
     */
    public Set<String> domain(Variable variable) {
        Set<String> words = domains.get(variable);
        if (words == null) {
            throw new IllegalArgumentException("Unknown variable: " + variable);
        }
        return Collections.unmodifiableSet(words);
    }

    public int size(Variable variable) {
        return domain(variable).size();
    }

    public boolean isEmpty(Variable variable) {
        return domain(variable).isEmpty();
    }

    public boolean hasEmptyDomain() {
        return domains.values().stream().anyMatch(Set::isEmpty);
    }

    /**
     * Removes every word of {@code variable}'s domain matching {@code filter}.
     *
     * @return the number of words removed
     */
    public int removeIf(Variable variable, Predicate<String> filter) {
        Set<String> words = domains.get(variable);
        if (words == null) {
            throw new IllegalArgumentException("Unknown variable: " + variable);
        }
        int removed = 0;
        for (Iterator<String> it = words.iterator(); it.hasNext(); ) {
            String word = it.next();
            if (filter.test(word)) {
                it.remove();
                trail.push(new Removal(variable, word));
                removed++;
            }
        }
        return removed;
    }

    /**
     * Narrows {@code variable}'s domain to the single word {@code value}.
     */
    public void narrowTo(Variable variable, String value) {
        removeIf(variable, word -> !word.equals(value));
    }

    public int checkpoint() {
        return trail.size();
    }

    /**
     * Restores every word removed since {@code checkpoint} was taken.
     */
    public void rollback(int checkpoint) {
        if (checkpoint < 0 || checkpoint > trail.size()) {
            throw new IllegalArgumentException("Invalid checkpoint " + checkpoint + ", trail height is " + trail.size());
        }
        while (trail.size() > checkpoint) {
            Removal removal = trail.pop();
            domains.get(removal.variable).add(removal.word);
        }
    }

    /**
     * Forgets the trail; removals made so far become permanent.
     */
    public void commit() {
        trail.clear();
    }

    /**
     * Deep immutable copy of the current domains.
     */
    public Map<Variable, Set<String>> snapshot() {
        Map<Variable, Set<String>> copy = new LinkedHashMap<>();
        domains.forEach((variable, words) -> copy.put(variable, Set.copyOf(words)));
        return Collections.unmodifiableMap(copy);
    }

    private static final class Removal {
        private final Variable variable;
        private final String word;

        private Removal(Variable variable, String word) {
            this.variable = variable;
            this.word = word;
        }
    }
}
