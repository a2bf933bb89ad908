package org.e2immu.analyzer.recursion.common;

public enum DispatchKind {
    // vtable
    CLASS_METHOD,
    // protocol conformance table
    WITNESS_METHOD,
    SUPER_METHOD,
    OBJC_METHOD,
    OBJC_SUPER_METHOD
}
