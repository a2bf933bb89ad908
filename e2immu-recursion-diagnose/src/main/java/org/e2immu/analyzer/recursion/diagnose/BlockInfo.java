package org.e2immu.analyzer.recursion.diagnose;

import org.e2immu.analyzer.recursion.common.BasicBlock;
import org.e2immu.analyzer.recursion.common.CallSite;
import org.e2immu.analyzer.recursion.common.Instruction;
import org.e2immu.analyzer.recursion.common.Terminator;

/*
Summary of one block, for one set of invariants.
The two flags are set by the propagation passes of InfiniteRecursionAnalysis.
 */
class BlockInfo {
    final BasicBlock block;

    // non-null if this block contains a recursive call which forwards all invariant arguments
    final CallSite recursiveCall;

    final boolean hasInvariantCondition;

    // counts down while successors are found to reach a return
    int numSuccsNotReachingReturn;

    /*
    Is there a path from this block to a function return, without going through a recursive call?
    Propagated up the control flow, starting at returns.
    When memory is invariant, memory-writing instructions count as returns.
     */
    boolean reachesReturn;

    /*
    Is there a path from the entry to this block, without going through a block which reaches a return?
    Propagated down the control flow, starting at the entry.
     */
    boolean reachableFromEntry;

    BlockInfo(BasicBlock block, Invariants invariants, CallClassifier callClassifier) {
        this.block = block;
        Terminator terminator = block.terminator();
        this.numSuccsNotReachingReturn = terminator.successors().size();
        this.hasInvariantCondition = invariants.isInvariant(terminator);

        CallSite found = null;
        boolean returns = false;
        boolean scanComplete = true;
        for (Instruction instruction : block.instructions()) {
            if (instruction instanceof CallSite callSite && callSite.isFullCall()) {
                // assert-like terminations must not disqualify the warning: ignore the block
                if (callSite.isCalleeKnownProgramTerminationPoint()) {
                    scanComplete = false;
                    break;
                }
                if (callClassifier.isRecursiveCall(callSite) && invariants.hasInvariantArguments(callSite)) {
                    found = callSite;
                    scanComplete = false;
                    break;
                }
            }
            if (invariants.isMemoryInvariant() && mayWriteToMemory(instruction)) {
                // a write may break the recursion loop; for the analysis, it acts as a return
                returns = true;
                scanComplete = false;
                break;
            }
        }
        if (scanComplete && (terminator.isFunctionExiting() || terminator.isProgramTerminating())) {
            returns = true;
        }
        this.recursiveCall = found;
        this.reachesReturn = returns;
    }

    /*
    A load writes when it copies (retain) or takes its value; neither can occur in an infinite recursion loop
    without another write re-initializing the memory. Access markers only delimit accesses.
     */
    static boolean mayWriteToMemory(Instruction instruction) {
        return switch (instruction.kind()) {
            case LOAD, BEGIN_ACCESS, END_ACCESS -> false;
            default -> instruction.mayWriteToMemory();
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("bb").append(block.index())
                .append(": numSuccs= ").append(numSuccsNotReachingReturn);
        if (recursiveCall != null) sb.append(" hasRecursiveCall");
        if (hasInvariantCondition) sb.append(" hasInvariantCondition");
        if (reachesReturn) sb.append(" reachesReturn");
        if (reachableFromEntry) sb.append(" reachesRecursiveCall");
        return sb.toString();
    }
}
