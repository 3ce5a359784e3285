package com.crossword.generator.render;

import com.crossword.generator.util.FileWriteUtil;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Plain-text rendering: one line per row, blocked cells as a full block.
 */
public class TextGridRenderer implements GridRenderer {

    public static final char BLOCKED = '█';

    public String render(LetterGrid grid) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < grid.getHeight(); i++) {
            for (int j = 0; j < grid.getWidth(); j++) {
                if (grid.isOpen(i, j)) {
                    Character letter = grid.letterAt(i, j);
                    sb.append(letter != null ? letter : ' ');
                } else {
                    sb.append(BLOCKED);
                }
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    @Override
    public void write(LetterGrid grid, Path output) throws IOException {
        FileWriteUtil.safeWriteString(output, render(grid));
    }
}
