package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Resolution of dynamically dispatched callees, provided by the host compiler.
 * Implementations may only answer with a function when the answer is certain.
 */
public interface CallTargetResolver {

    CallTargetResolver NONE = new CallTargetResolver() {
        @Override
        public boolean isDeclaredInCurrentModule(MethodLookup classMethod) {
            return false;
        }

        @Override
        public boolean calleesAreStaticallyKnowable(MethodLookup classMethod) {
            return false;
        }

        @Override
        public boolean isOverridden(MethodLookup classMethod) {
            return true;
        }

        @Override
        public Function lookUpClassMethod(MethodLookup classMethod) {
            return null;
        }

        @Override
        public Function lookUpWitnessMethod(MethodLookup witnessMethod) {
            return null;
        }
    };

    /*
    is the class of the dispatch operand declared in the module being compiled?
    Outside the module, vtables would have to be deserialized.
     */
    boolean isDeclaredInCurrentModule(@NotNull MethodLookup classMethod);

    /*
    all callee candidates are available for analysis (no overrides outside this compilation context)
     */
    boolean calleesAreStaticallyKnowable(@NotNull MethodLookup classMethod);

    boolean isOverridden(@NotNull MethodLookup classMethod);

    @Nullable
    Function lookUpClassMethod(@NotNull MethodLookup classMethod);

    @Nullable
    Function lookUpWitnessMethod(@NotNull MethodLookup witnessMethod);
}
