package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

class CallSiteImpl extends InstructionImpl implements CallSite {
    private final boolean fullCall;

    CallSiteImpl(BasicBlock block,
                 String name,
                 Value callee,
                 List<Value> arguments,
                 boolean fullCall,
                 SourceLocation location) {
        // a partial application only captures its arguments
        super(InstructionKind.CALL, block, name, operands(callee, arguments), fullCall, fullCall, location);
        this.fullCall = fullCall;
    }

    static List<Value> operands(Value callee, List<Value> arguments) {
        List<Value> operands = new ArrayList<>(arguments.size() + 1);
        operands.add(callee);
        operands.addAll(arguments);
        return operands;
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
        return fullCall;
    }

    @Override
    public String toString() {
        return "%" + name() + " = " + (fullCall ? "apply " : "partial_apply ") + callee() + arguments();
    }
}
