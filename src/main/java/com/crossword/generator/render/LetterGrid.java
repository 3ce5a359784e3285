package com.crossword.generator.render;

import com.crossword.generator.model.Crossword;
import com.crossword.generator.model.Variable;

import java.util.Map;

/**
 * Letters placed on the grid by an assignment. Cells nobody wrote to hold null.
 */
public class LetterGrid {

    private final Crossword crossword;
    private final Character[][] letters;

    public LetterGrid(Crossword crossword, Map<Variable, String> assignment) {
        this.crossword = crossword;
        this.letters = new Character[crossword.getHeight()][crossword.getWidth()];
        assignment.forEach((variable, word) -> {
            for (int k = 0; k < word.length() && k < variable.getLength(); k++) {
                Variable.Cell cell = variable.cellAt(k);
                letters[cell.getRow()][cell.getColumn()] = word.charAt(k);
            }
        });
    }

    public int getHeight() {
        return crossword.getHeight();
    }

    public int getWidth() {
        return crossword.getWidth();
    }

    public boolean isOpen(int row, int column) {
        return crossword.isOpen(row, column);
    }

    public Character letterAt(int row, int column) {
        return letters[row][column];
    }
}
