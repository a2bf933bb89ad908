package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

import java.util.List;

class FunctionRefImpl extends InstructionImpl implements FunctionRef {
    private final Function function;

    FunctionRefImpl(BasicBlock block, String name, Function function, SourceLocation location) {
        super(InstructionKind.FUNCTION_REF, block, name, List.of(), false, false, location);
        this.function = function;
    }

    @Override
    public @NotNull Function function() {
        return function;
    }

    @Override
    public String toString() {
        return "%" + name() + " = function_ref @" + function.name();
    }
}
