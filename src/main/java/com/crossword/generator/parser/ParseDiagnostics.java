package com.crossword.generator.parser;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings accumulated while reading puzzle input files.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ParseDiagnostics {
    private final List<String> warnings = new ArrayList<>();

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
