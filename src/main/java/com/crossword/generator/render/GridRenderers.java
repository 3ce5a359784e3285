package com.crossword.generator.render;

import com.crossword.generator.util.FileWriteUtil;

import java.nio.file.Path;

/**
 * Picks a renderer from an output file's extension.
 */
public final class GridRenderers {

    private GridRenderers() {
    }

    public static GridRenderer forPath(Path output) {
        return switch (FileWriteUtil.extension(output)) {
            case "png" -> new ImageGridRenderer();
            case "html", "htm" -> new HtmlGridRenderer();
            default -> new TextGridRenderer();
        };
    }
}
