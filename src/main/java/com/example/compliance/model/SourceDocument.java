package com.example.compliance.model;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * A document submitted for analysis, held in memory.
 *
 * @param filename original file name, used to pick the extraction strategy
 * @param content  raw file bytes
 */
public record SourceDocument(
        String filename,
        byte[] content
) {
    public SourceDocument {
        if (filename == null || filename.isBlank()) filename = "document.pdf";
        if (content == null) content = new byte[0];
    }

    /** Wraps plain text as a {@code .txt} document. */
    public static SourceDocument ofText(String name, String text) {
        String filename = name.toLowerCase(Locale.ROOT).endsWith(".txt") ? name : name + ".txt";
        return new SourceDocument(filename, text.getBytes(StandardCharsets.UTF_8));
    }

    /** Lowercased extension without the dot, or an empty string. */
    public String extension() {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
