package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/*
The unit of compilation handed to the analyzer in batch mode.
 */
public record CfgModule(@NotNull String name,
                        @NotNull List<Function> functions,
                        @NotNull CallTargetResolver callTargetResolver) {

    public CfgModule(String name, List<Function> functions) {
        this(name, functions, CallTargetResolver.NONE);
    }
}
