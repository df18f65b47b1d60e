package org.example.simplifier.model;

/**
 * One structural text unit of a document. {@code id} is the join key back to the container and never changes.
 */
public record Chapter(String id, String title, String content) {

    public Chapter withContent(String newContent) {
        return new Chapter(id, title, newContent);
    }
}
