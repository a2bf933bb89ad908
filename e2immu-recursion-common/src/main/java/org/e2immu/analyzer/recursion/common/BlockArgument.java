package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

/*
Merges values flowing in from the predecessors; never considered invariant.
 */
public interface BlockArgument extends Value {

    @NotNull
    BasicBlock block();

    int index();
}
