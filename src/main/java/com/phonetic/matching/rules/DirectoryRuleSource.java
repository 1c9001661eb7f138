package com.phonetic.matching.rules;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code <name>.txt} files from a directory.
 */
public class DirectoryRuleSource implements RuleSource {

    private static final String EXTENSION = ".txt";

    private final Path directory;

    public DirectoryRuleSource(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        this.directory = directory;
    }

    @Override
    public Optional<String> read(String name) {
        Path file = directory.resolve(name + EXTENSION);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuleResourceException("Failed to read rule file " + file, e);
        }
    }

    @Override
    public String describe() {
        return directory.toString();
    }
}
