package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

import java.util.List;

public interface Terminator extends Instruction {

    @NotNull
    TerminatorKind terminatorKind();

    /*
    may contain the same block more than once
     */
    @NotNull
    List<BasicBlock> successors();

    default boolean isFunctionExiting() {
        return terminatorKind().isFunctionExiting();
    }

    default boolean isProgramTerminating() {
        return terminatorKind().isProgramTerminating();
    }
}
