package com.crossbridge.generator.codegen.output;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical paths written during one generation session, keyed by their lower-cased form so
 * that paths differing only by case are caught on case-insensitive file systems too.
 *
 * Entries are never removed while the session lives.
 */
public class WrittenFileRegistry {

    private final Map<String, String> writtenFiles = new LinkedHashMap<>();

    /**
     * Registers a canonical path.
     *
     * @return the previously registered path with the same case-folded key, if any; the registry
     *         keeps the first one
     */
    public Optional<String> register(String canonicalPath) {
        return Optional.ofNullable(writtenFiles.putIfAbsent(caseFold(canonicalPath), canonicalPath));
    }

    public boolean contains(String canonicalPath) {
        return writtenFiles.containsKey(caseFold(canonicalPath));
    }

    public int size() {
        return writtenFiles.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(writtenFiles);
    }

    static String caseFold(String path) {
        return path.toLowerCase(Locale.ROOT);
    }
}
