package com.crossword.generator.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Parser for vocabulary files.
 *
 * Format:
 * - One word per line, case-insensitive (stored upper-case)
 * - Blank lines and lines starting with '#' are skipped
 * - Duplicates collapse into one entry
 */
public class WordListParser {
    private static final Logger log = LoggerFactory.getLogger(WordListParser.class);

    private static final Pattern LETTERS_ONLY = Pattern.compile("\\p{L}+");

    public Set<String> parse(Path wordsFile, ParseDiagnostics diagnostics) throws IOException {
        List<String> lines = Files.readAllLines(wordsFile, StandardCharsets.UTF_8);
        return parse(lines, diagnostics);
    }

    public Set<String> parse(List<String> lines, ParseDiagnostics diagnostics) {
        Set<String> words = new TreeSet<>();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            String word = trimmed.toUpperCase(Locale.ROOT);
            if (!LETTERS_ONLY.matcher(word).matches()) {
                diagnostics.addWarning("Line " + lineNum + ": word contains non-letter characters: " + trimmed);
            }
            if (!words.add(word)) {
                log.debug("Duplicate word on line {}: {}", lineNum, word);
            }
        }

        if (words.isEmpty()) {
            diagnostics.addWarning("Vocabulary is empty");
        }
        return words;
    }
}
