package org.e2immu.analyzer.recursion.common;

public enum Diagnostic {
    INFINITE_RECURSIVE_CALL(Severity.WARNING, "function call causes an infinite recursion");

    public enum Severity {WARNING, ERROR}

    private final Severity severity;
    private final String message;

    Diagnostic(Severity severity, String message) {
        this.severity = severity;
        this.message = message;
    }

    public Severity severity() {
        return severity;
    }

    public String message() {
        return message;
    }
}
