package com.crossword.generator.parser;

import com.crossword.generator.model.Crossword;
import com.crossword.generator.model.Variable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for reading puzzle files into a Crossword.
 */
class CrosswordParserTest {

    @TempDir
    Path tempDir;

    private final CrosswordParser parser = new CrosswordParser();

    @Test
    void testParseFiles() throws IOException {
        Path structure = tempDir.resolve("structure.txt");
        Path words = tempDir.resolve("words.txt");
        Files.writeString(structure, "___\n#_#\n#_#\n");
        Files.writeString(words, "cat\ndog\nact\n");

        Crossword crossword = parser.parse(structure, words, new ParseDiagnostics());

        assertThat(crossword.variables()).containsExactly(Variable.across(0, 0, 3), Variable.down(0, 1, 3));
        assertThat(crossword.vocabulary()).containsExactlyInAnyOrder("CAT", "DOG", "ACT");
    }

    @Test
    void testMissingFileFails() {
        Path words = tempDir.resolve("words.txt");

        assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.txt"), words, new ParseDiagnostics()))
                .isInstanceOf(NoSuchFileException.class);
    }
}
