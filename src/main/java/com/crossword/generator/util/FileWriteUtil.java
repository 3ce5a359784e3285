package com.crossword.generator.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Creates the directories above {@code filePath}, if any.
     */
    public static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }

    /**
     * Lower-case extension of the file name, without the dot; empty if there is none.
     */
    public static String extension(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
