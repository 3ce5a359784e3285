package com.crossword.generator.cli;

import com.crossword.generator.cli.exception.OptionsValidationException;
import com.crossword.generator.cli.model.GenerateOptions;
import com.crossword.generator.cli.model.ValidatedGenerateOptions;
import com.crossword.generator.cli.output.GenerateResultsPrinter;
import com.crossword.generator.cli.validation.GenerateOptionsValidator;
import com.crossword.generator.engine.CrosswordGenerator;
import com.crossword.generator.engine.GeneratorConfig;
import com.crossword.generator.engine.GeneratorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI command that fills a crossword grid from a word list.
 */
@Command(
        name = "crossword-generator",
        mixinStandardHelpOptions = true,
        version = "crossword-generator 1.0.0",
        description = "Fills a crossword structure with words from a vocabulary using constraint propagation and backtracking search."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    @Spec
    private CommandSpec spec;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @Override
    public Integer call() {
        GenerateResultsPrinter printer = new GenerateResultsPrinter(spec.commandLine().getOut());

        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .structureFile(validated.getStructureFile())
                .wordsFile(validated.getWordsFile())
                .outputFile(validated.getOutputFile())
                .timeout(validated.getTimeout())
                .build();

        GeneratorResult result = new CrosswordGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printOutcome(result);
        if (options.isStats()) {
            printer.printStats(result);
        }
        return 0;
    }
}
