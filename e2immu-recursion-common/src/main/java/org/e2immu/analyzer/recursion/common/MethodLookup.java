package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

/*
A callee obtained through dynamic dispatch. Operand 0 is the value the lookup dispatches on.
 */
public interface MethodLookup extends Instruction {

    @NotNull
    DispatchKind dispatchKind();

    /**
     * @return the name of the member being looked up, as the resolver understands it
     */
    @NotNull
    String member();
}
