package com.crossword.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.crossword.generator.cli.exception.OptionsValidationException;
import com.crossword.generator.cli.model.GenerateOptions;
import com.crossword.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getStructureFile() == null) {
			errors.add("Structure file is required.");
		} else if (!existsFile(o.getStructureFile())) {
			errors.add("Structure file does not exist or is not a regular file: " + o.getStructureFile());
		}

		if (o.getWordsFile() == null) {
			errors.add("Words file is required.");
		} else if (!existsFile(o.getWordsFile())) {
			errors.add("Words file does not exist or is not a regular file: " + o.getWordsFile());
		}

		if (o.getTimeoutMillis() < 0) {
			errors.add("Timeout must be >= 0. Got: " + o.getTimeoutMillis());
		}

		Path outputFile = null;
		if (o.getOutputFile() != null) {
			outputFile = o.getOutputFile().toAbsolutePath().normalize();

			if (Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			} else if (Files.exists(outputFile) && !o.isForce()) {
				errors.add("Output file already exists: " + outputFile + ". Use --force to overwrite.");
			}

			Path parent = outputFile.getParent();
			if (parent != null && Files.exists(parent) && !Files.isDirectory(parent)) {
				errors.add("Output parent is not a directory: " + parent);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Duration timeout = o.getTimeoutMillis() > 0 ? Duration.ofMillis(o.getTimeoutMillis()) : null;
		return new ValidatedGenerateOptions(o.getStructureFile(), o.getWordsFile(), outputFile, timeout);
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.exists(p) && Files.isRegularFile(p);
	}
}
