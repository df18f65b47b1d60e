package org.example.simplifier.service.worker;

public enum ChapterStage {
    PENDING,
    FETCHING_SUMMARY,
    REWRITING_WINDOWS,
    SMOOTHING_TRANSITIONS,
    DONE,
    FAILED
}
