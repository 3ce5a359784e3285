package com.crossword.generator.parser;

import com.crossword.generator.model.Crossword;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Reads a structure file and a word list into a {@link Crossword}.
 */
public class CrosswordParser {
    private static final Logger log = LoggerFactory.getLogger(CrosswordParser.class);

    private final StructureParser structureParser;
    private final WordListParser wordListParser;

    public CrosswordParser() {
        this(new StructureParser(), new WordListParser());
    }

    public CrosswordParser(StructureParser structureParser, WordListParser wordListParser) {
        this.structureParser = structureParser;
        this.wordListParser = wordListParser;
    }

    public Crossword parse(Path structureFile, Path wordsFile, ParseDiagnostics diagnostics) throws IOException {
        log.debug("Reading structure from {}", structureFile);
        boolean[][] structure = structureParser.parse(structureFile, diagnostics);
        log.debug("Reading words from {}", wordsFile);
        Set<String> words = wordListParser.parse(wordsFile, diagnostics);
        return build(structure, words);
    }

    public Crossword parse(List<String> structureLines, List<String> wordLines, ParseDiagnostics diagnostics) {
        boolean[][] structure = structureParser.parse(structureLines, diagnostics);
        Set<String> words = wordListParser.parse(wordLines, diagnostics);
        return build(structure, words);
    }

    private Crossword build(boolean[][] structure, Set<String> words) {
        Crossword crossword = new Crossword(structure, words);
        log.info("Loaded crossword: {}x{} grid, {} slots, {} words",
                crossword.getHeight(), crossword.getWidth(),
                crossword.variables().size(), crossword.vocabulary().size());
        return crossword;
    }
}
