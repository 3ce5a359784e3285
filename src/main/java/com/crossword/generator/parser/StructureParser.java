package com.crossword.generator.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for grid structure files.
 *
 * Format:
 * - One line per grid row
 * - '_' marks an open cell, any other character a blocked one
 * - Rows shorter than the widest row are blocked past their end
 */
public class StructureParser {
    private static final Logger log = LoggerFactory.getLogger(StructureParser.class);

    public static final char OPEN_CELL = '_';

    public boolean[][] parse(Path structureFile, ParseDiagnostics diagnostics) throws IOException {
        List<String> lines = Files.readAllLines(structureFile, StandardCharsets.UTF_8);
        return parse(lines, diagnostics);
    }

    public boolean[][] parse(List<String> lines, ParseDiagnostics diagnostics) {
        List<String> rows = new ArrayList<>();
        for (String line : lines) {
            rows.add(line.replace("\r", ""));
        }

        // Trailing blank lines are not part of the grid
        while (!rows.isEmpty() && rows.get(rows.size() - 1).isBlank()) {
            rows.remove(rows.size() - 1);
        }

        int width = rows.stream().mapToInt(String::length).max().orElse(0);
        boolean[][] structure = new boolean[rows.size()][width];
        int openCells = 0;
        for (int i = 0; i < rows.size(); i++) {
            String row = rows.get(i);
            for (int j = 0; j < row.length(); j++) {
                structure[i][j] = row.charAt(j) == OPEN_CELL;
                if (structure[i][j]) {
                    openCells++;
                }
            }
        }

        if (openCells == 0) {
            diagnostics.addWarning("Structure has no open cells");
        }
        log.debug("Parsed structure: {}x{} with {} open cells", rows.size(), width, openCells);
        return structure;
    }
}
