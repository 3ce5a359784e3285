package com.crossword.generator.cli.model;

import java.nio.file.Path;
import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path structureFile;
    Path wordsFile;
    Path outputFile;
    Duration timeout;
}
