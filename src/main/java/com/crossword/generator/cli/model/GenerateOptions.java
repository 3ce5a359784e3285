package com.crossword.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the generate command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(index = "0", paramLabel = "STRUCTURE", description = "Grid structure file ('_' marks an open cell)")
	private Path structureFile;

	@Parameters(index = "1", paramLabel = "WORDS", description = "Vocabulary file, one word per line")
	private Path wordsFile;

	@Parameters(index = "2", paramLabel = "OUTPUT", arity = "0..1", description = "Optional output file (.png, .html or text)")
	private Path outputFile;

	@Option(names = { "--timeout-ms" }, defaultValue = "0", description = "Abandon the search after this many milliseconds (0 = no limit)")
	private long timeoutMillis;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--stats" }, description = "Log solver statistics")
	private boolean stats;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
