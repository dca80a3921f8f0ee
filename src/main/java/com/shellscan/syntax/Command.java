package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

public sealed interface Command {
    record Simple(SimpleCommand command) implements Command {}
    record Compound(CompoundCommand command, MutableList<IoRedirect> redirects) implements Command {}
    record Function(FunctionDefinition definition) implements Command {}
    record ExtendedTest(ExtendedTestExpr expr) implements Command {}
}
