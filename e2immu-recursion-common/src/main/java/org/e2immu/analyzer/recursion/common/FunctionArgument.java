package org.e2immu.analyzer.recursion.common;

import org.jetbrains.annotations.NotNull;

public interface FunctionArgument extends Value {

    @NotNull
    Function function();

    /**
     * @return the position of this argument in <code>function().arguments()</code>
     */
    int index();
}
