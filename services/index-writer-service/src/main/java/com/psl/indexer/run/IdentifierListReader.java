package com.psl.indexer.run;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a newline-delimited identifier list. Blank lines and {@code #} comments are skipped; repeats collapse to
 * their first occurrence.
 */
public final class IdentifierListReader {
    private IdentifierListReader() {}

    public static List<String> read(Path path) throws IOException {
        Set<String> identifiers = new LinkedHashSet<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String value = line.trim();
            if (value.isEmpty() || value.startsWith("#")) {
                continue;
            }
            identifiers.add(value);
        }
        return new ArrayList<>(identifiers);
    }
}
