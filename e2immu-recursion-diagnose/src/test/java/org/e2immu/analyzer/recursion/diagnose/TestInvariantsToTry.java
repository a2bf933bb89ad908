package org.e2immu.analyzer.recursion.diagnose;

import org.e2immu.analyzer.recursion.common.*;
import org.e2immu.analyzer.recursion.common.impl.BasicBlockImpl;
import org.e2immu.analyzer.recursion.common.impl.FunctionImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestInvariantsToTry extends CommonTest {

    /*
    func f(a, b, c) {
      f(a, b, c); f(a, b, 0); f(a, b, c); f(a, 0, 0); f(0, b, 0); f(0, 0, c)
    }
     */
    private static List<CallSite> sixCalls(FunctionImpl.Builder builder) {
        FunctionArgument a = builder.addArgument("a");
        FunctionArgument b = builder.addArgument("b");
        FunctionArgument c = builder.addArgument("c");
        BasicBlockImpl bb0 = builder.addBlock();
        BasicBlockImpl bb1 = builder.addBlock();
        Instruction zero = bb0.literal("zero");
        FunctionRef self = bb0.functionRef("f", builder.function());
        CallSite c1 = bb0.call("r1", self, a, b, c);
        CallSite c2 = bb0.call("r2", self, a, b, zero);
        CallSite c3 = bb0.call("r3", self, a, b, c);
        bb0.br(bb1);
        CallSite c4 = bb1.call("r4", self, a, zero, zero);
        CallSite c5 = bb1.call("r5", self, zero, b, zero);
        CallSite c6 = bb1.call("r6", self, zero, zero, c);
        bb1.ret();
        builder.build();
        return List.of(c1, c2, c3, c4, c5, c6);
    }

    @DisplayName("ordered, without duplicates, limited")
    @Test
    public void test1() {
        FunctionImpl.Builder builder = new FunctionImpl.Builder("f");
        List<CallSite> calls = sixCalls(builder);
        Function f = builder.function();

        InvariantsToTry toTry = InvariantsToTry.collect(f, CALL_CLASSIFIER, 4);
        assertTrue(toTry.recursiveCallsFound());
        assertEquals(4, toTry.size());
        assertEquals(List.of(Invariants.noInvariants(),
                Invariants.fromForwardingArguments(calls.get(0)),
                Invariants.fromForwardingArguments(calls.get(1)),
                Invariants.fromForwardingArguments(calls.get(3))), toTry.list());
        assertEquals("[[], [arg0, arg1, arg2], [arg0, arg1], [arg0]]", toTry.toString());

        InvariantsToTry more = InvariantsToTry.collect(f, CALL_CLASSIFIER, 10);
        assertEquals(6, more.size());
        assertEquals(Invariants.fromForwardingArguments(calls.get(5)), more.list().get(5));

        InvariantsToTry one = InvariantsToTry.collect(f, CALL_CLASSIFIER, 1);
        assertEquals(List.of(Invariants.noInvariants()), one.list());
        assertTrue(one.recursiveCallsFound());
    }

    @DisplayName("no recursive calls")
    @Test
    public void test2() {
        Function fatalError = fatalError();
        FunctionImpl.Builder builder = new FunctionImpl.Builder("g");
        FunctionArgument x = builder.addArgument("x");
        BasicBlockImpl bb0 = builder.addBlock();
        FunctionRef other = bb0.functionRef("fatal", fatalError);
        bb0.call("r", other, x);
        FunctionRef self = bb0.functionRef("g", builder.function());
        // not a full call
        bb0.partialCall("p", self, x);
        bb0.ret();
        Function g = builder.build();

        InvariantsToTry toTry = InvariantsToTry.collect(g, CALL_CLASSIFIER, 4);
        assertFalse(toTry.recursiveCallsFound());
        assertEquals(List.of(Invariants.noInvariants()), toTry.list());
    }

    @DisplayName("a call without forwarded arguments adds nothing new")
    @Test
    public void test3() {
        Scenario scenario = mutatingRecursion();
        InvariantsToTry toTry = InvariantsToTry.collect(scenario.function(), CALL_CLASSIFIER, 4);
        assertTrue(toTry.recursiveCallsFound());
        assertEquals(1, toTry.size());

        Scenario guarded = invariantGuardedRecursion();
        InvariantsToTry toTry2 = InvariantsToTry.collect(guarded.function(), CALL_CLASSIFIER, 4);
        assertEquals("[[], [arg0]]", toTry2.toString());
    }
}
