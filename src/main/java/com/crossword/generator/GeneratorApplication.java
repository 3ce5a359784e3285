package com.crossword.generator;

import com.crossword.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Crossword Generator.
 * This CLI tool reads a grid structure and a word list and prints the grid
 * filled with words that agree on every crossing.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
