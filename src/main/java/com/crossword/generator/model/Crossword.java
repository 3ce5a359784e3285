package com.crossword.generator.model;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A crossword grid together with its vocabulary. Variables, overlaps and
 * neighbours are derived once from the open/blocked structure.
 */
public class Crossword implements PuzzleModel {

    @Getter
    private final int height;
    @Getter
    private final int width;

    private final boolean[][] structure;
    private final Set<String> words;
    private final Set<Variable> variables;
    private final Map<Variable, Map<Variable, Overlap>> overlaps = new HashMap<>();

    /**
     * @param structure {@code structure[row][column]} is true for an open cell; rows may be ragged
     * @param words     candidate words, used as given
     */
    public Crossword(boolean[][] structure, Set<String> words) {
        this.height = structure.length;
        int maxWidth = 0;
        for (boolean[] row : structure) {
            maxWidth = Math.max(maxWidth, row.length);
        }
        this.width = maxWidth;

        this.structure = new boolean[height][width];
        for (int i = 0; i < height; i++) {
            System.arraycopy(structure[i], 0, this.structure[i], 0, structure[i].length);
        }
        this.words = Collections.unmodifiableSet(new LinkedHashSet<>(words));
        this.variables = Collections.unmodifiableSet(findVariables());
        computeOverlaps();
    }

    public boolean isOpen(int row, int column) {
        return row >= 0 && row < height && column >= 0 && column < width && structure[row][column];
    }

    @Override
    public Set<Variable> variables() {
        return variables;
    }

    @Override
    public Set<Variable> neighbors(Variable variable) {
        Map<Variable, Overlap> crossing = overlaps.get(variable);
        return crossing == null ? Set.of() : Collections.unmodifiableSet(crossing.keySet());
    }

    @Override
    public Optional<Overlap> overlap(Variable first, Variable second) {
        Map<Variable, Overlap> crossing = overlaps.get(first);
        return crossing == null ? Optional.empty() : Optional.ofNullable(crossing.get(second));
    }

    @Override
    public Set<String> vocabulary() {
        return words;
    }

    private Set<Variable> findVariables() {
        Set<Variable> found = new TreeSet<>(Variable.POSITION_ORDER);
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                if (!structure[i][j]) {
                    continue;
                }

                // Across words start where the cell to the left is blocked
                if (!isOpen(i, j - 1)) {
                    int length = 1;
                    while (isOpen(i, j + length)) {
                        length++;
                    }
                    if (length > 1) {
                        found.add(Variable.across(i, j, length));
                    }
                }

                if (!isOpen(i - 1, j)) {
                    int length = 1;
                    while (isOpen(i + length, j)) {
                        length++;
                    }
                    if (length > 1) {
                        found.add(Variable.down(i, j, length));
                    }
                }
            }
        }
        return new LinkedHashSet<>(found);
    }

    private void computeOverlaps() {
        // Index every cell by the variables passing through it
        Map<Variable.Cell, Map<Variable, Integer>> byCell = new HashMap<>();
        for (Variable variable : variables) {
            List<Variable.Cell> cells = variable.cells();
            for (int k = 0; k < cells.size(); k++) {
                byCell.computeIfAbsent(cells.get(k), c -> new HashMap<>()).put(variable, k);
            }
        }

        for (Map<Variable, Integer> crossing : byCell.values()) {
            for (Map.Entry<Variable, Integer> a : crossing.entrySet()) {
                for (Map.Entry<Variable, Integer> b : crossing.entrySet()) {
                    if (a.getKey().equals(b.getKey())) {
                        continue;
                    }
                    overlaps.computeIfAbsent(a.getKey(), v -> new TreeMap<>(Variable.POSITION_ORDER))
                            .put(b.getKey(), new Overlap(a.getValue(), b.getValue()));
                }
            }
        }
    }
}
