package com.crossword.generator.solver;

import com.crossword.generator.model.Variable;
import lombok.Value;

/**
 * Directed constraint edge: revising it makes {@code x} consistent with {@code y}.
 */
@Value
public class Arc {
    Variable x;
    Variable y;
}
