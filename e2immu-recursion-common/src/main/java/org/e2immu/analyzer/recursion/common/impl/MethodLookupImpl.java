package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

import java.util.List;

class MethodLookupImpl extends InstructionImpl implements MethodLookup {
    private final DispatchKind dispatchKind;
    private final String member;

    MethodLookupImpl(BasicBlock block,
                     String name,
                     DispatchKind dispatchKind,
                     String member,
                     Value self,
                     SourceLocation location) {
        super(InstructionKind.METHOD_LOOKUP, block, name, List.of(self), false, false, location);
        this.dispatchKind = dispatchKind;
        this.member = member;
    }

    @Override
    public @NotNull DispatchKind dispatchKind() {
        return dispatchKind;
    }

    @Override
    public @NotNull String member() {
        return member;
    }

    @Override
    public String toString() {
        return "%" + name() + " = " + dispatchKind.name().toLowerCase() + " " + operand(0) + ", #" + member;
    }
}
