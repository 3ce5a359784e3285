package com.crossword.generator.model;

/**
 * Orientation of a word slot in the grid.
 */
public enum Direction {
    ACROSS,
    DOWN
}
