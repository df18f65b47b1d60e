package org.example.simplifier.epub;

public record EpubMetadata(String title, String language, String creator) {
}
