package org.e2immu.analyzer.recursion.diagnose;

import org.e2immu.analyzer.recursion.common.*;

import java.util.*;

/**
 * Describes what is expected to remain unchanged across one iteration of an infinite recursion.
 * <p>
 * Memory is all or nothing: either no memory is written, or we assume nothing about memory.
 * An argument is invariant when the recursive call forwards the incoming argument, as <code>x</code> in
 * <code>f(x, y - 1)</code>, but not <code>y</code>.
 * <p>
 * The choice of invariants never influences the correctness of the analysis, only the number of infinite
 * recursions it can find. More invariants make more branch conditions invariant, but they also exclude the
 * recursive calls which do not forward all invariant arguments.
 */
public final class Invariants {
    private static final int INVARIANT_MEMORY_BIT = 0;
    private static final int FIRST_ARGUMENT_BIT = 1;
    public static final int MAX_ARGUMENT_INDEX = 16;

    private static final Invariants NO_INVARIANTS = new Invariants(0);

    private final int bitMask;

    private Invariants(int bitMask) {
        this.bitMask = bitMask;
    }

    public static Invariants noInvariants() {
        return NO_INVARIANTS;
    }

    public static Invariants fromForwardingArguments(CallSite recursiveCall) {
        return fromForwardingArguments(recursiveCall, recursiveCall.block().function());
    }

    /**
     * @return invariants containing all the arguments which <code>recursiveCall</code> passes on unchanged
     */
    public static Invariants fromForwardingArguments(CallSite recursiveCall, Function enclosingFunction) {
        List<FunctionArgument> incoming = enclosingFunction.arguments();
        List<Value> actuals = recursiveCall.arguments();
        int bitMask = 0;
        for (int i = 0; i < actuals.size(); i++) {
            if (i <= MAX_ARGUMENT_INDEX && isForwarded(actuals.get(i), i, incoming)) {
                bitMask |= 1 << (i + FIRST_ARGUMENT_BIT);
            }
        }
        return new Invariants(bitMask);
    }

    public Invariants withInvariantMemory() {
        return new Invariants(bitMask | (1 << INVARIANT_MEMORY_BIT));
    }

    public boolean isMemoryInvariant() {
        return isBitSet(INVARIANT_MEMORY_BIT);
    }

    public boolean isArgumentInvariant(int argumentIndex) {
        return argumentIndex >= 0 && argumentIndex <= MAX_ARGUMENT_INDEX
               && isBitSet(argumentIndex + FIRST_ARGUMENT_BIT);
    }

    public boolean isEmpty() {
        return bitMask == 0;
    }

    /**
     * @return true when <code>terminator</code> is a conditional terminator, and its condition is invariant.
     * Conditions on an address are only invariant when memory is.
     */
    public boolean isInvariant(Terminator terminator) {
        return switch (terminator.terminatorKind().condition()) {
            case NONE -> false;
            case ADDRESS -> isMemoryInvariant() && isInvariantValue(terminator.operand(0));
            case VALUE -> isInvariantValue(terminator.operand(0));
        };
    }

    /**
     * @return true when <code>recursiveCall</code> forwards every argument we expect to be invariant
     */
    public boolean hasInvariantArguments(CallSite recursiveCall) {
        return hasInvariantArguments(recursiveCall, recursiveCall.block().function());
    }

    public boolean hasInvariantArguments(CallSite recursiveCall, Function enclosingFunction) {
        List<FunctionArgument> incoming = enclosingFunction.arguments();
        List<Value> actuals = recursiveCall.arguments();
        for (int i = 0; i < actuals.size(); i++) {
            if (isArgumentInvariant(i) && !isForwarded(actuals.get(i), i, incoming)) {
                return false;
            }
        }
        return true;
    }

    /*
    Walks the use-def chains starting at value, and returns true if all values visited are invariant.
    Every node is visited at most once per query.
     */
    private boolean isInvariantValue(Value value) {
        Set<Value> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Value> toDo = new ArrayDeque<>();
        toDo.push(value);
        while (!toDo.isEmpty()) {
            Value v = toDo.pop();
            if (!visited.add(v)) continue;

            if (v instanceof Instruction instruction) {
                if (!isMemoryInvariant() && instruction.mayReadFromMemory()) return false;
                for (Value operand : instruction.operands()) {
                    if (!visited.contains(operand)) toDo.push(operand);
                }
            } else if (v instanceof FunctionArgument argument) {
                if (!isArgumentInvariant(argument.index())) return false;
            } else {
                // block arguments merge values from different paths
                return false;
            }
        }
        return true;
    }

    private static boolean isForwarded(Value actual, int index, List<FunctionArgument> incoming) {
        return index < incoming.size() && stripAccessMarkers(actual) == incoming.get(index);
    }

    static Value stripAccessMarkers(Value value) {
        Value v = value;
        while (v instanceof Instruction instruction && instruction.kind() == InstructionKind.BEGIN_ACCESS) {
            v = instruction.operand(0);
        }
        return v;
    }

    private boolean isBitSet(int bit) {
        return (bitMask & (1 << bit)) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Invariants other && bitMask == other.bitMask;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bitMask);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        if (isMemoryInvariant()) joiner.add("memory");
        for (int i = 0; i <= MAX_ARGUMENT_INDEX; i++) {
            if (isArgumentInvariant(i)) joiner.add("arg" + i);
        }
        return joiner.toString();
    }
}
