package org.e2immu.analyzer.recursion.common;

public enum InstructionKind {
    LOAD,
    BEGIN_ACCESS,
    END_ACCESS,
    FUNCTION_REF,
    METHOD_LOOKUP,
    CALL,
    TERMINATOR,
    OTHER
}
