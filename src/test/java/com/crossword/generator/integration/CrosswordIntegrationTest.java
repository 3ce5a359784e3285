package com.crossword.generator.integration;

import com.crossword.generator.cli.GenerateCommand;
import com.crossword.generator.cli.output.GenerateResultsPrinter;
import com.crossword.generator.engine.CrosswordGenerator;
import com.crossword.generator.engine.GeneratorConfig;
import com.crossword.generator.engine.GeneratorResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the command line end to end against files on disk.
 */
class CrosswordIntegrationTest {

    private static final String NL = System.lineSeparator();

    @TempDir
    Path tempDir;

    private Path structure;
    private Path words;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        structure = Files.writeString(tempDir.resolve("structure.txt"), "___\n#_#\n#_#\n");
        words = Files.writeString(tempDir.resolve("words.txt"), "cat\nDOG\n# comment\n\nact\n");
        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    void testPrintsFilledGrid() {
        int exitCode = run(structure.toString(), words.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("ACT" + NL + "█A█" + NL + "█T█" + NL);
    }

    @Test
    void testPrintsNoSolution() throws IOException {
        Path centre = Files.writeString(tempDir.resolve("centre.txt"), "#_#\n___\n#_#\n");

        int exitCode = run(centre.toString(), words.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(GenerateResultsPrinter.NO_SOLUTION + NL);
    }

    @Test
    void testWritesPngOutput() throws IOException {
        Path output = tempDir.resolve("out/grid.png");

        int exitCode = run("--stats", structure.toString(), words.toString(), output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.exists(output)).isTrue();
        assertThat(ImageIO.read(output.toFile()).getWidth()).isEqualTo(300);
        // The grid is still printed when a file is written
        assertThat(out.toString()).startsWith("ACT");
    }

    @Test
    void testWritesHtmlOutput() throws IOException {
        Path output = tempDir.resolve("grid.html");

        int exitCode = run(structure.toString(), words.toString(), output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).contains("<td class=\"open\">C</td>");
    }

    @Test
    void testNoOutputFileWhenUnsolved() throws IOException {
        Path centre = Files.writeString(tempDir.resolve("centre.txt"), "#_#\n___\n#_#\n");
        Path output = tempDir.resolve("grid.txt");

        int exitCode = run(centre.toString(), words.toString(), output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void testMissingInputFails() {
        int exitCode = run(tempDir.resolve("missing.txt").toString(), words.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path output = Files.writeString(tempDir.resolve("grid.txt"), "old");

        assertThat(run(structure.toString(), words.toString(), output.toString())).isEqualTo(1);
        assertThat(Files.readString(output)).isEqualTo("old");

        assertThat(run("-f", structure.toString(), words.toString(), output.toString())).isZero();
        assertThat(Files.readString(output)).startsWith("ACT");
    }

    @Test
    void testUsageErrors() {
        assertThat(run("--no-such-option", structure.toString(), words.toString())).isEqualTo(2);
        assertThat(run(structure.toString())).isEqualTo(2);
        assertThat(err.toString()).isNotEmpty();
    }

    @Test
    void testGeneratorReportsUnreadableInput() {
        GeneratorConfig config = GeneratorConfig.builder()
                .structureFile(tempDir.resolve("missing.txt"))
                .wordsFile(words)
                .build();

        GeneratorResult result = new CrosswordGenerator(config).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isSolved()).isFalse();
        assertThat(result.getErrorMessage()).startsWith("I/O error:");
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new GenerateCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }
}
