package org.e2immu.analyzer.recursion.common;

public enum TerminatorKind {
    RETURN(Exit.FUNCTION, Condition.NONE),
    THROW(Exit.FUNCTION, Condition.NONE),
    UNWIND(Exit.FUNCTION, Condition.NONE),
    UNREACHABLE(Exit.PROGRAM, Condition.NONE),

    BRANCH(Exit.NONE, Condition.NONE),
    DYNAMIC_METHOD_BRANCH(Exit.NONE, Condition.NONE),
    TRY_CALL(Exit.NONE, Condition.NONE),

    COND_BRANCH(Exit.NONE, Condition.VALUE),
    SWITCH_VALUE(Exit.NONE, Condition.VALUE),
    SWITCH_ENUM(Exit.NONE, Condition.VALUE),
    CHECKED_CAST_BRANCH(Exit.NONE, Condition.VALUE),
    CHECKED_CAST_VALUE_BRANCH(Exit.NONE, Condition.VALUE),

    SWITCH_ENUM_ADDR(Exit.NONE, Condition.ADDRESS),
    CHECKED_CAST_ADDR_BRANCH(Exit.NONE, Condition.ADDRESS);

    private enum Exit {NONE, FUNCTION, PROGRAM}

    public enum Condition {
        NONE,
        // operand 0 is the scalar the branch decision depends on
        VALUE,
        // operand 0 is an address; the decision depends on the memory it points to
        ADDRESS
    }

    private final Exit exit;
    private final Condition condition;

    TerminatorKind(Exit exit, Condition condition) {
        this.exit = exit;
        this.condition = condition;
    }

    public boolean isFunctionExiting() {
        return exit == Exit.FUNCTION;
    }

    public boolean isProgramTerminating() {
        return exit == Exit.PROGRAM;
    }

    public Condition condition() {
        return condition;
    }

    public boolean isConditional() {
        return condition != Condition.NONE;
    }
}
