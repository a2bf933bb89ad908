package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

/*
A statically known callee.
 */
public interface FunctionRef extends Instruction {

    @NotNull
    Function function();
}
