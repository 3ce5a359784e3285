package com.crossword.generator.solver;

import com.crossword.generator.PuzzleFixtures;
import com.crossword.generator.model.Crossword;
import com.crossword.generator.model.Variable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NodeConsistency.
 */
class NodeConsistencyTest {

    private final NodeConsistency nodeConsistency = new NodeConsistency();

    @Test
    void testRemovesWordsOfWrongLength() {
        Crossword crossword = PuzzleFixtures.crossword(PuzzleFixtures.DISJOINT, "CAT", "DOG", "AT", "GO", "HORSE");
        DomainStore store = DomainStore.fromVocabulary(crossword);

        int removed = nodeConsistency.enforce(store, crossword);

        assertThat(removed).isEqualTo(6);
        assertThat(store.domain(Variable.across(0, 0, 3))).containsExactlyInAnyOrder("CAT", "DOG");
        assertThat(store.domain(Variable.across(2, 2, 2))).containsExactlyInAnyOrder("AT", "GO");
    }

    @Test
    void testIsIdempotent() {
        Crossword crossword = PuzzleFixtures.crossword(PuzzleFixtures.RING, "CAT", "DOG", "AT", "HORSE");
        DomainStore store = DomainStore.fromVocabulary(crossword);

        nodeConsistency.enforce(store, crossword);
        Map<Variable, Set<String>> once = store.snapshot();
        int removedAgain = nodeConsistency.enforce(store, crossword);

        assertThat(removedAgain).isZero();
        assertThat(store.snapshot()).isEqualTo(once);
    }

    @Test
    void testSlotWithoutMatchingLengthEndsEmpty() {
        Crossword crossword = PuzzleFixtures.crossword(List.of("_____"), "CAT", "DOG");
        DomainStore store = DomainStore.fromVocabulary(crossword);

        nodeConsistency.enforce(store, crossword);

        assertThat(store.isEmpty(Variable.across(0, 0, 5))).isTrue();
        assertThat(store.hasEmptyDomain()).isTrue();
    }
}
