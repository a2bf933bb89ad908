package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/*
Read-only view of a function body, as provided by the host compiler.
Identity is object identity: a call is recursive when its target is the same Function object.
 */
public interface Function {

    @NotNull
    String name();

    @NotNull
    List<FunctionArgument> arguments();

    /**
     * @return all blocks, ordered by index; the entry block comes first
     */
    @NotNull
    List<BasicBlock> blocks();

    @NotNull
    default BasicBlock entryBlock() {
        return blocks().get(0);
    }

    /**
     * @return true when the body was obtained by deserializing another module; such bodies have
     * already been diagnosed when that module was compiled
     */
    boolean isDeserialized();

    /**
     * @return true when calling this function is an intentional, assert-like termination of the program
     */
    boolean isProgramTerminationPoint();
}
