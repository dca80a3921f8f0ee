package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

public record Pipeline(boolean timed, boolean bang, MutableList<Command> seq) {}
