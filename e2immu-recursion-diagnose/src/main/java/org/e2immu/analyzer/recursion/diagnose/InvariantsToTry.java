package org.e2immu.analyzer.recursion.diagnose;

import org.e2immu.analyzer.recursion.common.BasicBlock;
import org.e2immu.analyzer.recursion.common.CallSite;
import org.e2immu.analyzer.recursion.common.Function;
import org.e2immu.analyzer.recursion.common.Instruction;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/*
To catch all cases, we'd have to try all permutations of arguments and memory.
In practice, it is good enough to look at the arguments each recursive call forwards.
The number of candidates is limited, to avoid quadratic complexity in corner cases.
 */
public class InvariantsToTry implements Iterable<Invariants> {
    private final Set<Invariants> invariants = new LinkedHashSet<>();
    private final int maxSize;
    private boolean recursiveCallsFound;

    private InvariantsToTry(int maxSize) {
        assert maxSize >= 1;
        this.maxSize = maxSize;
    }

    public static InvariantsToTry collect(Function function, CallClassifier callClassifier, int maxSize) {
        InvariantsToTry result = new InvariantsToTry(maxSize);
        result.invariants.add(Invariants.noInvariants());
        for (BasicBlock block : function.blocks()) {
            for (Instruction instruction : block.instructions()) {
                if (instruction instanceof CallSite callSite && callClassifier.isRecursiveCall(callSite, function)) {
                    result.recursiveCallsFound = true;
                    if (result.invariants.size() < maxSize) {
                        result.invariants.add(Invariants.fromForwardingArguments(callSite, function));
                    }
                    if (result.invariants.size() >= maxSize) return result;
                }
            }
        }
        return result;
    }

    /**
     * @return false when the function does not contain a single recursive call; then there is no need to run
     * the analysis
     */
    public boolean recursiveCallsFound() {
        return recursiveCallsFound;
    }

    public int size() {
        return invariants.size();
    }

    public List<Invariants> list() {
        return List.copyOf(invariants);
    }

    @Override
    public Iterator<Invariants> iterator() {
        return invariants.iterator();
    }

    @Override
    public String toString() {
        return invariants.toString();
    }
}
