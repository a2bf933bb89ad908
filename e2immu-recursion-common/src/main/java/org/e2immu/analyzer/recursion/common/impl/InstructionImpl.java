package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

import java.util.List;

class InstructionImpl implements Instruction {
    private final InstructionKind kind;
    private final BasicBlock block;
    private final String name;
    private final List<Value> operands;
    private final boolean mayReadFromMemory;
    private final boolean mayWriteToMemory;
    private final SourceLocation location;

    InstructionImpl(InstructionKind kind,
                    BasicBlock block,
                    String name,
                    List<Value> operands,
                    boolean mayReadFromMemory,
                    boolean mayWriteToMemory,
                    SourceLocation location) {
        this.kind = kind;
        this.block = block;
        this.name = name;
        this.operands = List.copyOf(operands);
        this.mayReadFromMemory = mayReadFromMemory;
        this.mayWriteToMemory = mayWriteToMemory;
        this.location = location;
    }

    @Override
    public @NotNull InstructionKind kind() {
        return kind;
    }

    @Override
    public @NotNull BasicBlock block() {
        return block;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public @NotNull List<Value> operands() {
        return operands;
    }

    @Override
    public boolean mayReadFromMemory() {
        return mayReadFromMemory;
    }

    @Override
    public boolean mayWriteToMemory() {
        return mayWriteToMemory;
    }

    @Override
    public @NotNull SourceLocation location() {
        return location;
    }

    @Override
    public String toString() {
        return "%" + name + " = " + kind.name().toLowerCase() + " " + operands;
    }
}
