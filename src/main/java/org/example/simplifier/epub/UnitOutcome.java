package org.example.simplifier.epub;

public enum UnitOutcome {
    REWRITTEN,
    UNCHANGED,
    FAILED
}
