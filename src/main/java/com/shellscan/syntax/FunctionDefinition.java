package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

public record FunctionDefinition(String name, CompoundCommand body, MutableList<IoRedirect> redirects) {}
