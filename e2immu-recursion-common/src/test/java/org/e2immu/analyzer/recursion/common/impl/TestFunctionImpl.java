package org.e2immu.analyzer.recursion.common.impl;

import org.e2immu.analyzer.recursion.common.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestFunctionImpl {

    @DisplayName("blocks, edges, arguments")
    @Test
    public void test1() {
        FunctionImpl.Builder builder = new FunctionImpl.Builder("f");
        FunctionArgument x = builder.addArgument("x");
        FunctionArgument y = builder.addArgument("y");
        BasicBlockImpl bb0 = builder.addBlock();
        BasicBlockImpl bb1 = builder.addBlock();
        BasicBlockImpl bb2 = builder.addBlock();

        Instruction cmp = bb0.instruction("cmp", false, false, x, y);
        Terminator t0 = bb0.condBr(cmp, bb1, bb2);
        FunctionRef ref = bb1.functionRef("f", builder.function());
        CallSite call = bb1.call("r", ref, x, y);
        bb1.br(bb2);
        bb2.ret();
        Function f = builder.build();

        assertSame(f, builder.function());
        assertEquals(List.of(x, y), f.arguments());
        assertEquals(1, y.index());
        assertSame(bb0, f.entryBlock());
        assertTrue(bb0.isEntry());
        assertFalse(bb2.isEntry());
        assertEquals(2, bb2.index());

        assertSame(t0, bb0.terminator());
        assertEquals(List.of(cmp, t0), bb0.instructions());
        assertEquals(List.of(bb1, bb2), bb0.successors());
        assertEquals(List.of(bb0), bb1.predecessors());
        assertEquals(List.of(bb0, bb1), bb2.predecessors());
        assertTrue(bb0.predecessors().isEmpty());

        assertSame(f, call.referencedFunction());
        assertSame(ref, call.callee());
        assertEquals(List.of(x, y), call.arguments());
        assertTrue(call.isFullCall());
        assertTrue(call.mayWriteToMemory());
        assertFalse(call.isCalleeKnownProgramTerminationPoint());
        assertSame(bb1, call.block());
        assertEquals(InstructionKind.CALL, call.kind());
        assertEquals(InstructionKind.TERMINATOR, t0.kind());
        assertSame(cmp, t0.operand(0));

        assertThrows(IllegalStateException.class, builder::addBlock);
        assertThrows(IllegalStateException.class, () -> bb2.literal("late"));
        assertThrows(UnsupportedOperationException.class, () -> f.blocks().clear());
    }

    @DisplayName("an edge is a predecessor entry, also when duplicated")
    @Test
    public void test2() {
        FunctionImpl.Builder builder = new FunctionImpl.Builder("g");
        BasicBlockImpl bb0 = builder.addBlock();
        BasicBlockImpl bb1 = builder.addBlock();
        Instruction c = bb0.literal("c");
        bb0.condBr(c, bb1, bb1);
        bb1.ret();
        builder.build();

        assertEquals(2, bb0.successors().size());
        assertEquals(List.of(bb0, bb0), bb1.predecessors());
    }

    @DisplayName("source locations")
    @Test
    public void test3() {
        FunctionImpl.Builder builder = new FunctionImpl.Builder("h", "H.swift");
        BasicBlockImpl bb0 = builder.addBlock();
        Instruction i1 = bb0.literal("one");
        Instruction i2 = bb0.at(12, 7).literal("two");
        Instruction i3 = bb0.literal("three");
        bb0.ret();
        builder.build();

        assertEquals(new SourceLocation("H.swift", 1, 1), i1.location());
        assertEquals(new SourceLocation("H.swift", 12, 7), i2.location());
        assertEquals("H.swift:2:1", i3.location().toString());
    }

    @DisplayName("try call is a terminator and a call")
    @Test
    public void test4() {
        FunctionImpl.Builder builder = new FunctionImpl.Builder("t");
        BasicBlockImpl bb0 = builder.addBlock();
        BasicBlockImpl bb1 = builder.addBlock();
        BasicBlockImpl bb2 = builder.addBlock();
        FunctionRef ref = bb0.functionRef("t", builder.function());
        Terminator tryCall = bb0.tryCall(ref, bb1, bb2);
        bb1.ret();
        Instruction error = bb2.literal("error");
        bb2.throwValue(error);
        builder.build();

        assertEquals(TerminatorKind.TRY_CALL, tryCall.terminatorKind());
        assertInstanceOf(CallSite.class, tryCall);
        CallSite callSite = (CallSite) tryCall;
        assertTrue(callSite.isFullCall());
        assertSame(builder.function(), callSite.referencedFunction());
        assertTrue(callSite.arguments().isEmpty());
        assertTrue(bb2.terminator().isFunctionExiting());
        assertThrows(IllegalArgumentException.class, () -> new FunctionImpl.Builder("u").addBlock()
                .terminate(TerminatorKind.TRY_CALL, List.of()));
    }

    @DisplayName("program termination point")
    @Test
    public void test5() {
        FunctionImpl.Builder fatal = new FunctionImpl.Builder("fatalError").setProgramTerminationPoint(true);
        fatal.addBlock().unreachable();
        Function fatalError = fatal.build();
        assertTrue(fatalError.isProgramTerminationPoint());
        assertTrue(fatalError.entryBlock().terminator().isProgramTerminating());

        FunctionImpl.Builder builder = new FunctionImpl.Builder("v").setDeserialized(true);
        BasicBlockImpl bb0 = builder.addBlock();
        FunctionRef ref = bb0.functionRef("fatal", fatalError);
        CallSite call = bb0.call("r", ref);
        CallSite partial = bb0.partialCall("p", ref);
        bb0.unreachable();
        Function v = builder.build();

        assertTrue(v.isDeserialized());
        assertTrue(call.isCalleeKnownProgramTerminationPoint());
        assertFalse(partial.isFullCall());
        assertFalse(partial.mayWriteToMemory());
    }

    @DisplayName("malformed control flow graphs")
    @Test
    public void test6() {
        FunctionImpl.Builder noBlocks = new FunctionImpl.Builder("a");
        assertThrows(IllegalStateException.class, noBlocks::build);

        FunctionImpl.Builder noTerminator = new FunctionImpl.Builder("b");
        noTerminator.addBlock().literal("x");
        assertThrows(IllegalStateException.class, noTerminator::build);

        FunctionImpl.Builder entryWithPredecessor = new FunctionImpl.Builder("c");
        BasicBlockImpl c0 = entryWithPredecessor.addBlock();
        BasicBlockImpl c1 = entryWithPredecessor.addBlock();
        c0.br(c1);
        c1.br(c0);
        assertThrows(IllegalStateException.class, entryWithPredecessor::build);

        FunctionImpl.Builder deadEnd = new FunctionImpl.Builder("d");
        deadEnd.addBlock().terminate(TerminatorKind.BRANCH, List.of());
        assertThrows(IllegalStateException.class, deadEnd::build);

        FunctionImpl.Builder other = new FunctionImpl.Builder("e");
        BasicBlockImpl e0 = other.addBlock();
        BasicBlockImpl d0 = new FunctionImpl.Builder("f").addBlock();
        assertThrows(IllegalStateException.class, () -> e0.br(d0));

        BasicBlockImpl e1 = other.addBlock();
        assertThrows(IllegalArgumentException.class, () -> e1.terminate(TerminatorKind.COND_BRANCH, List.of(), e0));

        e1.ret();
        assertThrows(IllegalStateException.class, e1::ret);
    }
}
