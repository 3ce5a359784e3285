package com.crossword.generator.engine;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for a crossword generation run.
 */
@Data
@Builder
public class GeneratorConfig {
    private Path structureFile;
    private Path wordsFile;

    /**
     * Where to save the filled grid; null to skip saving.
     */
    private Path outputFile;

    /**
     * Search bound; null or zero for none.
     */
    private Duration timeout;
}
