package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

public record SourceLocation(@NotNull String file, int line, int column) {
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
