package com.crossword.generator.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A word slot in the grid: start cell, length and orientation.
 * Two variables are equal iff all four fields match.
 */
@Value
public class Variable {

    /**
     * Row-major order of start cells; used wherever a deterministic tie-break is needed.
     */
    public static final Comparator<Variable> POSITION_ORDER = Comparator
            .comparingInt(Variable::getRow)
            .thenComparingInt(Variable::getColumn)
            .thenComparing(Variable::getDirection)
            .thenComparingInt(Variable::getLength);

    int row;
    int column;
    int length;
    Direction direction;

    public static Variable across(int row, int column, int length) {
        return new Variable(row, column, length, Direction.ACROSS);
    }

    public static Variable down(int row, int column, int length) {
        return new Variable(row, column, length, Direction.DOWN);
    }

    /**
     * Grid cells covered by this variable, in word order.
     */
    public List<Cell> cells() {
        List<Cell> cells = new ArrayList<>(length);
        for (int k = 0; k < length; k++) {
            cells.add(cellAt(k));
        }
        return cells;
    }

    /**
     * The cell holding the character at {@code index} of this variable's word.
     */
    public Cell cellAt(int index) {
        return direction == Direction.ACROSS
                ? new Cell(row, column + index)
                : new Cell(row + index, column);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ") " + direction + " : " + length;
    }

    /**
     * A single grid position.
     */
    @Value
    public static class Cell {
        int row;
        int column;
    }
}
