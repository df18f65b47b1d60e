package org.example.simplifier.service.gateway;

public enum SummaryScope {
    BOOK("whole book"),
    CHAPTER("single chapter");

    private final String description;

    SummaryScope(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
