package org.e2immu.analyzer.recursion.common;

/*
A node in the def-use graph of a function body: either the result of an instruction,
a formal argument of the function, or an argument of a basic block (phi).
 */
public interface Value {

    String name();
}
