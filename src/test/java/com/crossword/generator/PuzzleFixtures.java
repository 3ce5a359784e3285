package com.crossword.generator;

import com.crossword.generator.model.Crossword;
import com.crossword.generator.parser.CrosswordParser;
import com.crossword.generator.parser.ParseDiagnostics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Small grids shared by the tests.
 */
public final class PuzzleFixtures {

    /** One across and one down slot of length 3; across index 1 meets down index 0. */
    public static final List<String> CROSS_AT_TOP = List.of(
            "___",
            "#_#",
            "#_#");

    /** One across and one down slot of length 3 meeting at index 1 of both. */
    public static final List<String> CROSS_AT_CENTRE = List.of(
            "#_#",
            "___",
            "#_#");

    /** Four slots of length 3 around a blocked centre. */
    public static final List<String> RING = List.of(
            "___",
            "_#_",
            "___");

    /** Two slots that never cross. */
    public static final List<String> DISJOINT = List.of(
            "___#",
            "####",
            "##__");

    /** Three across and three down slots of length 5 on a lattice. */
    public static final List<String> LATTICE = List.of(
            "_____",
            "_#_#_",
            "_____",
            "_#_#_",
            "_____");

    private PuzzleFixtures() {
    }

    public static Crossword crossword(List<String> structure, String... words) {
        return new CrosswordParser().parse(structure, List.of(words), new ParseDiagnostics());
    }

    /**
     * A clock that moves forward by {@code step} every time it is read.
     */
    public static Clock steppingClock(Duration step) {
        return new Clock() {
            private Instant now = Instant.parse("2024-01-01T00:00:00Z");

            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                Instant current = now;
                now = now.plus(step);
                return current;
            }
        };
    }
}
