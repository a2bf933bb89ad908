package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/*
Mutable while the owning FunctionImpl.Builder has not been built; every method creating an instruction
appends it to the block. The terminator methods close the block.
 */
public class BasicBlockImpl implements BasicBlock {
    private final FunctionImpl function;
    private final int index;
    private final List<Instruction> instructions = new ArrayList<>();
    private final List<BlockArgument> arguments = new ArrayList<>();
    private final List<BasicBlock> predecessors = new ArrayList<>();
    private Terminator terminator;
    private SourceLocation nextLocation;

    BasicBlockImpl(FunctionImpl function, int index) {
        this.function = function;
        this.index = index;
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
    public @NotNull List<Instruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    @Override
    public @NotNull Terminator terminator() {
        if (terminator == null) throw new IllegalStateException("Block bb" + index + " has no terminator");
        return terminator;
    }

    @Override
    public @NotNull List<BlockArgument> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public @NotNull List<BasicBlock> predecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    boolean hasTerminator() {
        return terminator != null;
    }

    void addPredecessor(BasicBlock predecessor) {
        predecessors.add(predecessor);
    }

    @Override
    public String toString() {
        return "bb" + index;
    }

    // ---------------------------------------------------------------------------------------------------------------

    /**
     * Sets the source location of the next instruction created in this block.
     */
    public BasicBlockImpl at(int line, int column) {
        nextLocation = new SourceLocation(function.file(), line, column);
        return this;
    }

    public BlockArgument addArgument(String name) {
        checkOpen();
        BlockArgument argument = new BlockArgumentImpl(this, arguments.size(), name);
        arguments.add(argument);
        return argument;
    }

    /*
    generic instruction, e.g. arithmetic (no memory effects) or a builtin
     */
    public Instruction instruction(String name, boolean mayRead, boolean mayWrite, Value... operands) {
        return add(new InstructionImpl(InstructionKind.OTHER, this, name, Arrays.asList(operands),
                mayRead, mayWrite, location()));
    }

    public Instruction literal(String name) {
        return instruction(name, false, false);
    }

    // a copying load reports a write, because it retains the loaded value
    public Instruction load(String name, Value address) {
        return add(new InstructionImpl(InstructionKind.LOAD, this, name, List.of(address), true, true, location()));
    }

    public Instruction store(Value value, Value address) {
        return add(new InstructionImpl(InstructionKind.OTHER, this, function.freshName("store"),
                List.of(value, address), false, true, location()));
    }

    public Instruction beginAccess(String name, Value address) {
        return add(new InstructionImpl(InstructionKind.BEGIN_ACCESS, this, name, List.of(address), true, true,
                location()));
    }

    public Instruction endAccess(Value access) {
        return add(new InstructionImpl(InstructionKind.END_ACCESS, this, function.freshName("end_access"),
                List.of(access), true, true, location()));
    }

    public FunctionRef functionRef(String name, Function target) {
        return add(new FunctionRefImpl(this, name, target, location()));
    }

    public MethodLookup methodLookup(String name, DispatchKind dispatchKind, String member, Value self) {
        return add(new MethodLookupImpl(this, name, dispatchKind, member, self, location()));
    }

    public CallSite call(String name, Value callee, Value... arguments) {
        return add(new CallSiteImpl(this, name, callee, Arrays.asList(arguments), true, location()));
    }

    public CallSite partialCall(String name, Value callee, Value... arguments) {
        return add(new CallSiteImpl(this, name, callee, Arrays.asList(arguments), false, location()));
    }

    // ---------------------------------------------------------------------------------------------------------------

    public Terminator ret(Value... values) {
        return terminate(TerminatorKind.RETURN, Arrays.asList(values));
    }

    public Terminator throwValue(Value error) {
        return terminate(TerminatorKind.THROW, List.of(error));
    }

    public Terminator unreachable() {
        return terminate(TerminatorKind.UNREACHABLE, List.of());
    }

    public Terminator br(BasicBlock target) {
        return terminate(TerminatorKind.BRANCH, List.of(), target);
    }

    public Terminator condBr(Value condition, BasicBlock ifTrue, BasicBlock ifFalse) {
        return terminate(TerminatorKind.COND_BRANCH, List.of(condition), ifTrue, ifFalse);
    }

    public Terminator switchValue(Value value, BasicBlock... cases) {
        return terminate(TerminatorKind.SWITCH_VALUE, List.of(value), cases);
    }

    public Terminator switchEnum(Value value, BasicBlock... cases) {
        return terminate(TerminatorKind.SWITCH_ENUM, List.of(value), cases);
    }

    public Terminator switchEnumAddr(Value address, BasicBlock... cases) {
        return terminate(TerminatorKind.SWITCH_ENUM_ADDR, List.of(address), cases);
    }

    public Terminator checkedCastBranch(Value value, BasicBlock success, BasicBlock failure) {
        return terminate(TerminatorKind.CHECKED_CAST_BRANCH, List.of(value), success, failure);
    }

    public Terminator tryCall(Value callee, BasicBlock normal, BasicBlock error, Value... arguments) {
        checkOpen();
        for (BasicBlock successor : List.of(normal, error)) checkSameFunction(successor);
        TryCallImpl tryCall = new TryCallImpl(this, callee, Arrays.asList(arguments), normal, error, location());
        instructions.add(tryCall);
        terminator = tryCall;
        return tryCall;
    }

    public Terminator terminate(TerminatorKind kind, List<Value> operands, BasicBlock... successors) {
        checkOpen();
        if (kind == TerminatorKind.TRY_CALL) {
            throw new IllegalArgumentException("Use tryCall() to create a " + kind + " terminator");
        }
        if (kind.isConditional() && operands.isEmpty()) {
            throw new IllegalArgumentException("Conditional terminator " + kind + " needs a condition operand");
        }
        for (BasicBlock successor : successors) checkSameFunction(successor);
        boolean readsMemory = kind.condition() == TerminatorKind.Condition.ADDRESS;
        Terminator t = new TerminatorImpl(this, kind, operands, Arrays.asList(successors), readsMemory, false,
                location());
        instructions.add(t);
        terminator = t;
        return t;
    }

    // ---------------------------------------------------------------------------------------------------------------

    private <I extends Instruction> I add(I instruction) {
        checkOpen();
        instructions.add(instruction);
        return instruction;
    }

    private SourceLocation location() {
        SourceLocation location = nextLocation != null ? nextLocation : function.nextLocation();
        nextLocation = null;
        return location;
    }

    private void checkOpen() {
        if (function.isFrozen()) throw new IllegalStateException("Function " + function.name() + " has been built");
        if (terminator != null) throw new IllegalStateException("Block bb" + index + " already has a terminator");
    }

    private void checkSameFunction(BasicBlock successor) {
        if (successor.function() != function) {
            throw new IllegalStateException("Successor " + successor + " of bb" + index + " belongs to function "
                                            + successor.function().name());
        }
    }
}
