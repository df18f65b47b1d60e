package org.example.simplifier.service.checkpoint;

/**
 * Job-scoped checkpoint record, written once per job and updated when the global summary is cached.
 */
public record DocumentMetadata(
        int schemaVersion,
        int simplificationLevel,
        int totalChapters,
        String globalSummary     // nullable until summarized
) {
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static DocumentMetadata create(int simplificationLevel, int totalChapters) {
        return new DocumentMetadata(CURRENT_SCHEMA_VERSION, simplificationLevel, totalChapters, null);
    }

    public DocumentMetadata withGlobalSummary(String summary) {
        return new DocumentMetadata(schemaVersion, simplificationLevel, totalChapters, summary);
    }

    public boolean hasGlobalSummary() {
        return globalSummary != null && !globalSummary.isBlank();
    }

    public boolean isCompatibleWith(int level) {
        return schemaVersion == CURRENT_SCHEMA_VERSION && simplificationLevel == level;
    }
}
