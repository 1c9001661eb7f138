package com.phonetic.matching.rules;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Reads {@code <name>.txt} resources from the classpath under a base path.
 */
public class ClasspathRuleSource implements RuleSource {

    /** Bundled Beider-Morse rules. */
    public static final String BEIDER_MORSE_PATH = "com/phonetic/matching/bm/";

    /** Bundled Daitch-Mokotoff rules. */
    public static final String DAITCH_MOKOTOFF_PATH = "com/phonetic/matching/dm/";

    private static final String EXTENSION = ".txt";

    private final String basePath;
    private final ClassLoader classLoader;

    public ClasspathRuleSource(String basePath) {
        this(basePath, ClasspathRuleSource.class.getClassLoader());
    }

    public ClasspathRuleSource(String basePath, ClassLoader classLoader) {
        if (basePath == null) {
            throw new IllegalArgumentException("basePath cannot be null");
        }
        this.basePath = basePath.isEmpty() || basePath.endsWith("/") ? basePath : basePath + "/";
        this.classLoader = classLoader;
    }

    public static ClasspathRuleSource beiderMorse() {
        return new ClasspathRuleSource(BEIDER_MORSE_PATH);
    }

    public static ClasspathRuleSource daitchMokotoff() {
        return new ClasspathRuleSource(DAITCH_MOKOTOFF_PATH);
    }

    @Override
    public Optional<String> read(String name) {
        String path = basePath + name + EXTENSION;
        try (InputStream in = classLoader.getResourceAsStream(path)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuleResourceException("Failed to read classpath resource " + path, e);
        }
    }

    @Override
    public String describe() {
        return "classpath:" + basePath;
    }
}
