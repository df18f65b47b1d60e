package org.example.simplifier.epub;

import org.example.simplifier.model.Chapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable in-memory EPUB: every zip entry in original order plus the parsed package information.
 * Rewriting never mutates a document; {@link EpubReader#fromEntries} builds a new one.
 */
public final class EpubDocument {

    private final String sourceDigest;
    private final Map<String, byte[]> entries;
    private final String packagePath;
    private final EpubMetadata metadata;
    private final List<StructuralUnit> units;
    private final List<Chapter> chapters;

    EpubDocument(String sourceDigest,
                 Map<String, byte[]> entries,
                 String packagePath,
                 EpubMetadata metadata,
                 List<StructuralUnit> units,
                 List<Chapter> chapters) {
        this.sourceDigest = sourceDigest;
        Map<String, byte[]> copy = new LinkedHashMap<>();
        entries.forEach((name, bytes) -> copy.put(name, bytes.clone()));
        this.entries = Collections.unmodifiableMap(copy);
        this.packagePath = packagePath;
        this.metadata = metadata;
        this.units = List.copyOf(units);
        this.chapters = List.copyOf(chapters);
    }

    /**
     * SHA-256 of the bytes this document was originally read from, hex encoded.
     */
    public String sourceDigest() {
        return sourceDigest;
    }

    public String packagePath() {
        return packagePath;
    }

    public EpubMetadata metadata() {
        return metadata;
    }

    public List<StructuralUnit> units() {
        return units;
    }

    public List<Chapter> chapters() {
        return chapters;
    }

    public Set<String> entryNames() {
        return entries.keySet();
    }

    public Optional<byte[]> entry(String name) {
        byte[] bytes = entries.get(name);
        return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
    }

    /**
     * Entry map with the given replacements applied, original order kept.
     */
    Map<String, byte[]> entriesWith(Map<String, byte[]> replacements) {
        Map<String, byte[]> merged = new LinkedHashMap<>();
        entries.forEach((name, bytes) -> merged.put(name, replacements.getOrDefault(name, bytes)));
        return merged;
    }

    Map<String, byte[]> rawEntries() {
        return entries;
    }
}
