package io.github.superyaml.core;

/// Compilation stage that raised a {@link SyamlException}. The label prefixes every message.
public enum ErrorKind {
    EXPRESSION("expression error"),
    CYCLE("cycle error"),
    CONSTRAINT("constraint error"),
    ENVIRONMENT("environment error"),
    PATH("path error"),
    SERIALIZATION("serialization error");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
