package com.crossword.generator.model;

import lombok.Value;

/**
 * The shared cell of two crossing variables, expressed as a character index
 * into each variable's word.
 */
@Value
public class Overlap {
    int firstIndex;
    int secondIndex;

    /**
     * The same overlap seen from the other variable.
     */
    public Overlap swap() {
        return new Overlap(secondIndex, firstIndex);
    }

    /**
     * True if the two words agree on the shared cell. A word too short to
     * reach its index never agrees.
     */
    public boolean agrees(String first, String second) {
        return firstIndex < first.length()
                && secondIndex < second.length()
                && first.charAt(firstIndex) == second.charAt(secondIndex);
    }
}
