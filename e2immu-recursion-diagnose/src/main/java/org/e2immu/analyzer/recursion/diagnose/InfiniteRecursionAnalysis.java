package org.e2immu.analyzer.recursion.diagnose;

import org.e2immu.analyzer.recursion.common.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Detects infinite recursion loops in one function, for one set of invariants.
 * <p>
 * The idea is to see if there is a path from the entry block to a function return which does not go through
 * a recursive call. If there is none, the function never returns normally; a forward pass from the entry then
 * finds the recursive calls responsible, if any. Functions which only end in program termination, or which
 * loop forever without recursion, are not diagnosed.
 * <p>
 * Instances are created for a single (function, invariants) pair, and discarded afterwards.
 */
public class InfiniteRecursionAnalysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(InfiniteRecursionAnalysis.class);

    private final Function function;
    private final BlockInfo[] blockInfos;

    InfiniteRecursionAnalysis(Function function, Invariants invariants, CallClassifier callClassifier) {
        this.function = function;
        List<BasicBlock> blocks = function.blocks();
        blockInfos = new BlockInfo[blocks.size()];
        for (BasicBlock block : blocks) {
            int index = block.index();
            if (index < 0 || index >= blockInfos.length || blockInfos[index] != null) {
                throw new IllegalStateException("Invalid block index " + index + " in function " + function.name());
            }
            blockInfos[index] = new BlockInfo(block, invariants, callClassifier);
        }
    }

    BlockInfo info(BasicBlock block) {
        return blockInfos[block.index()];
    }

    /**
     * Performs the analysis, and reports the recursive calls of infinite recursion loops to the sink.
     *
     * @return true when at least one infinitely recursive call has been found
     */
    public static boolean analyzeAndDiagnose(Function function,
                                             Invariants invariants,
                                             CallClassifier callClassifier,
                                             DiagnosticSink diagnosticSink) {
        InfiniteRecursionAnalysis analysis = new InfiniteRecursionAnalysis(function, invariants, callClassifier);
        boolean entryReachesReturn = analysis.isEntryReachableFromReturn();
        boolean found = !entryReachesReturn && analysis.findRecursiveCallsAndDiagnose(diagnosticSink);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Function {}, invariants {}, found infinite recursion: {}\n{}", function.name(), invariants,
                    found, analysis.dump());
        }
        return found;
    }

    /*
    Propagates the reachesReturn flags up the control flow; returns true if the flag reaches the entry block.
     */
    boolean isEntryReachableFromReturn() {
        Deque<BasicBlock> workList = new ArrayDeque<>();
        for (BlockInfo blockInfo : blockInfos) {
            if (blockInfo.reachesReturn) workList.push(blockInfo.block);
        }

        while (!workList.isEmpty()) {
            BasicBlock block = workList.pop();
            for (BasicBlock predecessor : block.predecessors()) {
                BlockInfo predInfo = info(predecessor);
                // recursive calls block the propagation
                if (predInfo.reachesReturn || predInfo.recursiveCall != null) continue;

                if (predInfo.numSuccsNotReachingReturn <= 0) {
                    throw new IllegalStateException("Inconsistent CFG in function " + function.name() + ": "
                                                    + predecessor + " has more predecessor edges than successors");
                }
                predInfo.numSuccsNotReachingReturn--;

                /*
                Usually, reachesReturn propagates when any of the successors has it.
                For an invariant condition, all successors must have it: once a successor which leads to a
                recursive call is taken, it will be taken again in every iteration.
                 */
                if (predInfo.hasInvariantCondition && predInfo.numSuccsNotReachingReturn > 0) continue;

                predInfo.reachesReturn = true;
                workList.push(predecessor);
            }
        }
        return info(function.entryBlock()).reachesReturn;
    }

    /*
    Propagates the reachableFromEntry flags down the control flow, and reports each recursive call it reaches.
     */
    boolean findRecursiveCallsAndDiagnose(DiagnosticSink diagnosticSink) {
        Deque<BasicBlock> workList = new ArrayDeque<>();
        BasicBlock entryBlock = function.entryBlock();
        info(entryBlock).reachableFromEntry = true;
        workList.push(entryBlock);

        boolean foundInfiniteRecursion = false;
        while (!workList.isEmpty()) {
            BasicBlock block = workList.pop();
            CallSite recursiveCall = info(block).recursiveCall;
            if (recursiveCall != null) {
                LOGGER.debug("Infinite recursion in {} at {}", function.name(), recursiveCall.location());
                diagnosticSink.diagnose(recursiveCall.location(), Diagnostic.INFINITE_RECURSIVE_CALL);
                foundInfiniteRecursion = true;
                continue;
            }
            for (BasicBlock successor : block.successors()) {
                BlockInfo succInfo = info(successor);
                if (!succInfo.reachesReturn && !succInfo.reachableFromEntry) {
                    succInfo.reachableFromEntry = true;
                    workList.push(successor);
                }
            }
        }
        return foundInfiniteRecursion;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        for (BlockInfo blockInfo : blockInfos) {
            sb.append(blockInfo).append('\n');
        }
        return sb.toString();
    }
}
