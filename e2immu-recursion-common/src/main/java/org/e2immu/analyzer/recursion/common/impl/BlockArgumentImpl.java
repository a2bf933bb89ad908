package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.BasicBlock;
import org.e2immu.analyzer.recursion.common.BlockArgument;
import org.jetbrains.annotations.NotNull;

class BlockArgumentImpl implements BlockArgument {
    private final BasicBlock block;
    private final int index;
    private final String name;

    BlockArgumentImpl(BasicBlock block, int index, String name) {
        if (index < 0) throw new IllegalArgumentException("Negative block argument index " + index);
        this.block = block;
        this.index = index;
        this.name = name;
    }

    @Override
    public @NotNull BasicBlock block() {
        return block;
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
