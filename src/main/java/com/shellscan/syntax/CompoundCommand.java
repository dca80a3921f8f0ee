package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

public sealed interface CompoundCommand {
    record BraceGroup(CompoundList list) implements CompoundCommand {}
    record Subshell(CompoundList list) implements CompoundCommand {}

    // values is null when the clause iterates "$@"
    record ForClause(String variable, MutableList<Word> values, DoGroup body) implements CompoundCommand {}

    record CaseClause(Word value, MutableList<CaseItem> cases) implements CompoundCommand {}
    record IfClause(CompoundList condition, CompoundList then, MutableList<ElseClause> elses) implements CompoundCommand {}
    record WhileClause(CompoundList condition, DoGroup body) implements CompoundCommand {}
    record UntilClause(CompoundList condition, DoGroup body) implements CompoundCommand {}
    record ArithmeticForClause(String header, DoGroup body) implements CompoundCommand {}
    record Arithmetic(String expression) implements CompoundCommand {}

    record DoGroup(CompoundList list) {}

    // cmd is null for an empty arm
    record CaseItem(MutableList<Word> patterns, CompoundList cmd, CaseItemTerminator terminator) {}

    enum CaseItemTerminator {
        BREAK,
        FALL_THROUGH,
        CONTINUE_MATCHING
    }

    // An elif arm when condition is present, the final else otherwise
    record ElseClause(CompoundList condition, CompoundList body) {}
}
