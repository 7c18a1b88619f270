package org.learningjava.hpes.domain.model;

public record ExtractionWarning(WarningKind kind, String message) {

    public static ExtractionWarning of(WarningKind kind, String message) {
        return new ExtractionWarning(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
