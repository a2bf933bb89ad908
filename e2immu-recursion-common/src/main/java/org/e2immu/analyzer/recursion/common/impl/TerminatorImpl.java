package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

class TerminatorImpl extends InstructionImpl implements Terminator {
    private final TerminatorKind terminatorKind;
    private final List<BasicBlock> successors;

    TerminatorImpl(BasicBlock block,
                   TerminatorKind terminatorKind,
                   List<Value> operands,
                   List<BasicBlock> successors,
                   boolean mayReadFromMemory,
                   boolean mayWriteToMemory,
                   SourceLocation location) {
        super(InstructionKind.TERMINATOR, block, terminatorKind.name().toLowerCase(), operands,
                mayReadFromMemory, mayWriteToMemory, location);
        this.terminatorKind = terminatorKind;
        this.successors = List.copyOf(successors);
    }

    @Override
    public @NotNull TerminatorKind terminatorKind() {
        return terminatorKind;
    }

    @Override
    public @NotNull List<BasicBlock> successors() {
        return successors;
    }

    @Override
    public String toString() {
        String succ = successors.stream().map(b -> "bb" + b.index()).collect(Collectors.joining(", "));
        return terminatorKind.name().toLowerCase() + " " + operands() + (succ.isEmpty() ? "" : " -> " + succ);
    }
}
