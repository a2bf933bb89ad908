package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

import java.util.List;

public interface Instruction extends Value {

    @NotNull
    InstructionKind kind();

    @NotNull
    BasicBlock block();

    @NotNull
    List<Value> operands();

    default Value operand(int index) {
        return operands().get(index);
    }

    boolean mayReadFromMemory();

    boolean mayWriteToMemory();

    @NotNull
    SourceLocation location();
}
