package com.crossword.generator.render;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a filled grid to a file in some format.
 */
public interface GridRenderer {

    void write(LetterGrid grid, Path output) throws IOException;
}
