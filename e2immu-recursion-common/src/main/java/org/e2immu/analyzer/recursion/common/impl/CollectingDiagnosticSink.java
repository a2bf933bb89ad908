package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.Diagnostic;
import org.e2immu.analyzer.recursion.common.DiagnosticSink;
import org.e2immu.analyzer.recursion.common.SourceLocation;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/*
Thread-safe: can be shared when functions are analyzed in parallel.
 */
public class CollectingDiagnosticSink implements DiagnosticSink {

    public record Emitted(SourceLocation location, Diagnostic diagnostic) {
        @Override
        public String toString() {
            return location + ": " + diagnostic.severity().name().toLowerCase() + ": " + diagnostic.message();
        }
    }

    private final List<Emitted> emitted = new CopyOnWriteArrayList<>();

    @Override
    public void diagnose(@NotNull SourceLocation location, @NotNull Diagnostic diagnostic) {
        emitted.add(new Emitted(location, diagnostic));
    }

    public List<Emitted> emitted() {
        return List.copyOf(emitted);
    }

    public List<SourceLocation> locations() {
        return emitted.stream().map(Emitted::location).toList();
    }

    public boolean isEmpty() {
        return emitted.isEmpty();
    }

    public void clear() {
        emitted.clear();
    }
}
