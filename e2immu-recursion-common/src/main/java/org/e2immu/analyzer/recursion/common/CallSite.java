package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public interface CallSite extends Instruction {

    @NotNull
    Value callee();

    @NotNull
    List<Value> arguments();

    /**
     * @return false for a partial application, which does not invoke the callee
     */
    boolean isFullCall();

    /**
     * @return the callee if it is statically known, null otherwise
     */
    @Nullable
    default Function referencedFunction() {
        return callee() instanceof FunctionRef ref ? ref.function() : null;
    }

    /*
    assert-like program termination, such as a fatal error helper
     */
    default boolean isCalleeKnownProgramTerminationPoint() {
        Function function = referencedFunction();
        return function != null && function.isProgramTerminationPoint();
    }
}
