package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FunctionImpl implements Function {
    private final String name;
    private final String file;
    private final List<FunctionArgument> arguments = new ArrayList<>();
    private final List<BasicBlock> blocks = new ArrayList<>();
    private boolean deserialized;
    private boolean programTerminationPoint;
    private boolean frozen;
    private int instructionCounter;

    private FunctionImpl(String name, String file) {
        this.name = name;
        this.file = file;
    }

    @Override
    public @NotNull String name() {
        return name;
    }

    public String file() {
        return file;
    }

    @Override
    public @NotNull List<FunctionArgument> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public @NotNull List<BasicBlock> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    @Override
    public boolean isDeserialized() {
        return deserialized;
    }

    @Override
    public boolean isProgramTerminationPoint() {
        return programTerminationPoint;
    }

    boolean isFrozen() {
        return frozen;
    }

    // instructions without explicit location get one line each, in creation order
    SourceLocation nextLocation() {
        return new SourceLocation(file, ++instructionCounter, 1);
    }

    String freshName(String prefix) {
        return prefix + instructionCounter;
    }

    @Override
    public String toString() {
        return "@" + name;
    }

    public static class Builder {
        private final FunctionImpl function;

        public Builder(String name) {
            this(name, name + ".swift");
        }

        public Builder(String name, String file) {
            function = new FunctionImpl(name, file);
        }

        /**
         * @return the function under construction, so that it can be referenced (by itself, or by other functions)
         * before it is built
         */
        public Function function() {
            return function;
        }

        public Builder setDeserialized(boolean deserialized) {
            function.deserialized = deserialized;
            return this;
        }

        public Builder setProgramTerminationPoint(boolean programTerminationPoint) {
            function.programTerminationPoint = programTerminationPoint;
            return this;
        }

        public FunctionArgument addArgument(String name) {
            checkNotBuilt();
            FunctionArgument argument = new FunctionArgumentImpl(function, function.arguments.size(), name);
            function.arguments.add(argument);
            return argument;
        }

        /*
        the first block added is the entry block
         */
        public BasicBlockImpl addBlock() {
            checkNotBuilt();
            BasicBlockImpl block = new BasicBlockImpl(function, function.blocks.size());
            function.blocks.add(block);
            return block;
        }

        public FunctionImpl build() {
            checkNotBuilt();
            if (function.blocks.isEmpty()) {
                throw new IllegalStateException("Function " + function.name + " has no blocks");
            }
            for (BasicBlock block : function.blocks) {
                BasicBlockImpl impl = (BasicBlockImpl) block;
                if (!impl.hasTerminator()) {
                    throw new IllegalStateException("Block " + block + " of " + function.name + " has no terminator");
                }
                Terminator terminator = block.terminator();
                if (terminator.successors().isEmpty()
                    && !terminator.isFunctionExiting()
                    && !terminator.isProgramTerminating()) {
                    throw new IllegalStateException("Block " + block + " of " + function.name + " ends in "
                                                    + terminator.terminatorKind() + " without successors");
                }
                for (BasicBlock successor : terminator.successors()) {
                    ((BasicBlockImpl) successor).addPredecessor(block);
                }
            }
            BasicBlock entry = function.blocks.get(0);
            if (!entry.predecessors().isEmpty()) {
                throw new IllegalStateException("Entry block of " + function.name + " has predecessors "
                                                + entry.predecessors());
            }
            function.frozen = true;
            return function;
        }

        private void checkNotBuilt() {
            if (function.frozen) throw new IllegalStateException("Function " + function.name + " has been built");
        }
    }
}
