package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.Function;
import org.e2immu.analyzer.recursion.common.FunctionArgument;
import org.jetbrains.annotations.NotNull;

class FunctionArgumentImpl implements FunctionArgument {
    private final Function function;
    private final int index;
    private final String name;

    FunctionArgumentImpl(Function function, int index, String name) {
        if (index < 0) throw new IllegalArgumentException("Negative argument index " + index);
        this.function = function;
        this.index = index;
        this.name = name;
    }

    @Override
    public @NotNull Function function() {
        return function;
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "%" + name;
    }
}
