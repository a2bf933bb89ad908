package org.e2immu.analyzer.recursion.diagnose;

import org.e2immu.analyzer.recursion.common.*;
import org.jetbrains.annotations.NotNull;

/*
Decides whether a call site statically calls the function it is part of.

Dynamic dispatch is only looked into when the host can resolve the target with certainty;
super-method and Objective-C dispatch are never considered recursive.
 */
public class CallClassifier {
    private final CallTargetResolver callTargetResolver;

    public CallClassifier(@NotNull CallTargetResolver callTargetResolver) {
        this.callTargetResolver = callTargetResolver;
    }

    public boolean isRecursiveCall(CallSite callSite) {
        return isRecursiveCall(callSite, callSite.block().function());
    }

    public boolean isRecursiveCall(CallSite callSite, Function enclosingFunction) {
        if (!callSite.isFullCall()) return false;

        Function calledFunction = callSite.referencedFunction();
        if (calledFunction != null) {
            return calledFunction == enclosingFunction;
        }
        if (!(callSite.callee() instanceof MethodLookup lookup)) {
            return false;
        }
        return switch (lookup.dispatchKind()) {
            case SUPER_METHOD, OBJC_METHOD, OBJC_SUPER_METHOD -> false;
            case CLASS_METHOD -> isRecursiveClassMethod(lookup, enclosingFunction);
            case WITNESS_METHOD -> callTargetResolver.lookUpWitnessMethod(lookup) == enclosingFunction;
        };
    }

    private boolean isRecursiveClassMethod(MethodLookup lookup, Function enclosingFunction) {
        // outside the current module, we'd have to deserialize vtables
        if (!callTargetResolver.isDeclaredInCurrentModule(lookup)) return false;
        if (!callTargetResolver.calleesAreStaticallyKnowable(lookup)) return false;
        // all candidates are known, but there still may be an override of this very method
        if (callTargetResolver.isOverridden(lookup)) return false;

        return callTargetResolver.lookUpClassMethod(lookup) == enclosingFunction;
    }
}
