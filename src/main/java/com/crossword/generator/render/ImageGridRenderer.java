package com.crossword.generator.render;

import com.crossword.generator.util.FileWriteUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * PNG rendering: white open cells with centred letters on a black background.
 */
public class ImageGridRenderer implements GridRenderer {
    private static final Logger log = LoggerFactory.getLogger(ImageGridRenderer.class);

    static final int CELL_SIZE = 100;
    static final int CELL_BORDER = 2;
    static final int INTERIOR_SIZE = CELL_SIZE - 2 * CELL_BORDER;

    private static final Font LETTER_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 80);

    public BufferedImage render(LetterGrid grid) {
        int width = Math.max(1, grid.getWidth() * CELL_SIZE);
        int height = Math.max(1, grid.getHeight() * CELL_SIZE);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);

        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, width, height);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);

            for (int i = 0; i < grid.getHeight(); i++) {
                for (int j = 0; j < grid.getWidth(); j++) {
                    if (!grid.isOpen(i, j)) {
                        continue;
                    }
                    int x = j * CELL_SIZE + CELL_BORDER;
                    int y = i * CELL_SIZE + CELL_BORDER;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, INTERIOR_SIZE, INTERIOR_SIZE);

                    Character letter = grid.letterAt(i, j);
                    if (letter != null) {
                        drawLetter(g, letter, x, y);
                    }
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    @Override
    public void write(LetterGrid grid, Path output) throws IOException {
        FileWriteUtil.createParentDirectories(output);
        if (!ImageIO.write(render(grid), "png", output.toFile())) {
            throw new IOException("No PNG writer available for " + output);
        }
        log.debug("Wrote image to {}", output);
    }

    private void drawLetter(Graphics2D g, char letter, int x, int y) {
        // Font metrics are only touched when there is text to draw
        g.setFont(LETTER_FONT);
        g.setColor(Color.BLACK);
        FontMetrics metrics = g.getFontMetrics();
        String text = String.valueOf(letter);
        int textX = x + (INTERIOR_SIZE - metrics.stringWidth(text)) / 2;
        int textY = y + (INTERIOR_SIZE - metrics.getHeight()) / 2 + metrics.getAscent();
        g.drawString(text, textX, textY);
    }
}
