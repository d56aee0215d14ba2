package com.linlay.reasoningrelay.model;

public enum SemanticEventKind {
    REASONING("reasoning"),
    CONTENT("content"),
    ANSWER("answer");

    private final String value;

    SemanticEventKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
