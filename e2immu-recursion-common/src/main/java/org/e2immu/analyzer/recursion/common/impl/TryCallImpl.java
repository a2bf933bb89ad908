package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/*
A call which ends its block: execution continues in the normal or in the error successor.
 */
class TryCallImpl extends TerminatorImpl implements CallSite {

    TryCallImpl(BasicBlock block,
                Value callee,
                List<Value> arguments,
                BasicBlock normal,
                BasicBlock error,
                SourceLocation location) {
        super(block, TerminatorKind.TRY_CALL, CallSiteImpl.operands(callee, arguments), List.of(normal, error),
                true, true, location);
    }

    @Override
    public @NotNull Value callee() {
        return operand(0);
    }

    @Override
    public @NotNull List<Value> arguments() {
        return operands().subList(1, operands().size());
    }

    @Override
    public boolean isFullCall() {
        return true;
    }
}
