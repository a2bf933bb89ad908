package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

@FunctionalInterface
public interface DiagnosticSink {

    void diagnose(@NotNull SourceLocation location, @NotNull Diagnostic diagnostic);
}
