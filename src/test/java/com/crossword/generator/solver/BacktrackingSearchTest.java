package com.crossword.generator.solver;

import com.crossword.generator.PuzzleFixtures;
import com.crossword.generator.model.Crossword;
import com.crossword.generator.model.Variable;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BacktrackingSearch driven directly, without the solver's
 * up-front arc consistency pass.
 */
class BacktrackingSearchTest {

    private static BacktrackingSearch search(Crossword crossword, DomainStore store, SolverConfig config) {
        return new BacktrackingSearch(crossword, store, new ArcConsistency(crossword, store), config);
    }

    private static DomainStore nodeConsistentStore(Crossword crossword) {
        DomainStore store = DomainStore.fromVocabulary(crossword);
        new NodeConsistency().enforce(store, crossword);
        return store;
    }

    @Test
    void testFindsCompleteConsistentAssignment() {
        Crossword ring = PuzzleFixtures.crossword(PuzzleFixtures.RING,
                "CAT", "CAR", "TOD", "ROD", "DOG", "COT", "ART", "RAT", "TAR", "OAT");

        SolveResult result = search(ring, nodeConsistentStore(ring), SolverConfig.defaults()).search(new Assignment());

        assertThat(result.isSolved()).isTrue();
        assertThat(result.getAssignment()).containsOnlyKeys(ring.variables());
        Assignment check = new Assignment();
        result.getAssignment().forEach(check::assign);
        assertThat(check.isConsistent(ring)).isTrue();
    }

    @Test
    void testExhaustionRestoresDomains() {
        // Four slots but only three words: distinctness can never be met
        Crossword ring = PuzzleFixtures.crossword(PuzzleFixtures.RING, "CAT", "CAR", "TOD");
        DomainStore store = nodeConsistentStore(ring);
        Map<Variable, Set<String>> before = store.snapshot();

        SolveResult result = search(ring, store, SolverConfig.defaults()).search(new Assignment());

        assertThat(result.isSolved()).isFalse();
        assertThat(result.isTimedOut()).isFalse();
        assertThat(result.getAssignment()).isEmpty();
        assertThat(result.getStats().getValuesTried()).isPositive();
        assertThat(store.snapshot()).isEqualTo(before);
    }

    @Test
    void testEmptyDomainStopsBeforeTryingAnything() {
        Crossword crossword = PuzzleFixtures.crossword(PuzzleFixtures.CROSS_AT_TOP, "CAT", "ACT");
        DomainStore store = DomainStore.of(Map.of(
                Variable.across(0, 0, 3), Set.of("CAT"),
                Variable.down(0, 1, 3), Set.of()));

        SolveResult result = search(crossword, store, SolverConfig.defaults()).search(new Assignment());

        assertThat(result.isSolved()).isFalse();
        assertThat(result.getStats().getValuesTried()).isZero();
    }

    @Test
    void testCompleteAssignmentIsReturnedAsIs() {
        Crossword crossword = PuzzleFixtures.crossword(PuzzleFixtures.CROSS_AT_TOP, "CAT", "ACT");
        Assignment assignment = new Assignment();
        assignment.assign(Variable.across(0, 0, 3), "CAT");
        assignment.assign(Variable.down(0, 1, 3), "ACT");

        SolveResult result = search(crossword, nodeConsistentStore(crossword), SolverConfig.defaults())
                .search(assignment);

        assertThat(result.isSolved()).isTrue();
        assertThat(result.getAssignment()).isEqualTo(assignment.asMap());
    }

    @Test
    void testTimeoutAbandonsSearch() {
        Crossword ring = PuzzleFixtures.crossword(PuzzleFixtures.RING,
                "CAT", "CAR", "TOD", "ROD", "DOG", "COT");
        DomainStore store = nodeConsistentStore(ring);
        Map<Variable, Set<String>> before = store.snapshot();
        SolverConfig config = SolverConfig.builder()
                .timeout(Duration.ofMillis(1))
                .clock(PuzzleFixtures.steppingClock(Duration.ofSeconds(1)))
                .build();

        SolveResult result = search(ring, store, config).search(new Assignment());

        assertThat(result.isSolved()).isFalse();
        assertThat(result.isTimedOut()).isTrue();
        assertThat(store.snapshot()).isEqualTo(before);
    }

    @Test
    void testDeepSearchDoesNotRecurse() {
        // A long row of disjoint two-letter slots: depth equals the number of slots
        StringBuilder row = new StringBuilder();
        String[] words = new String[400];
        for (int i = 0; i < words.length; i++) {
            row.append("__#");
            words[i] = "" + (char) ('A' + i % 26) + (char) ('A' + i / 26);
        }
        Crossword crossword = PuzzleFixtures.crossword(List.of(row.toString()), words);

        SolveResult result = search(crossword, nodeConsistentStore(crossword), SolverConfig.defaults())
                .search(new Assignment());

        assertThat(result.isSolved()).isTrue();
        assertThat(result.getAssignment()).hasSize(400);
        assertThat(Set.copyOf(result.getAssignment().values())).hasSize(400);
    }
}
