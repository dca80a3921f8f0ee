package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

public record Program(MutableList<CompoundList> completeCommands) {}
