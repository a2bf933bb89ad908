package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

import java.util.List;

public interface BasicBlock {

    @NotNull
    Function function();

    /**
     * A stable index, unique within the function, between 0 and the number of blocks (exclusive).
     * Analyses use it to store per-block information in arrays.
     */
    int index();

    /**
     * @return all instructions of the block, the terminator being the last one
     */
    @NotNull
    List<Instruction> instructions();

    @NotNull
    Terminator terminator();

    @NotNull
    List<BlockArgument> arguments();

    /**
     * One entry per incoming edge: a predecessor that branches twice to this block is present twice.
     */
    @NotNull
    List<BasicBlock> predecessors();

    @NotNull
    default List<BasicBlock> successors() {
        return terminator().successors();
    }

    default boolean isEntry() {
        return function().entryBlock() == this;
    }
}
