package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.Diagnostic;
import org.e2immu.analyzer.recursion.common.DiagnosticSink;
import org.e2immu.analyzer.recursion.common.SourceLocation;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDiagnosticSink implements DiagnosticSink {
    private static final Logger LOGGER = LoggerFactory.getLogger("diagnostics");

    @Override
    public void diagnose(@NotNull SourceLocation location, @NotNull Diagnostic diagnostic) {
        if (diagnostic.severity() == Diagnostic.Severity.ERROR) {
            LOGGER.error("{}: error: {}", location, diagnostic.message());
        } else {
            LOGGER.warn("{}: warning: {}", location, diagnostic.message());
        }
    }
}
