package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

// wordOrName is null for a bare assignment or redirect
public record SimpleCommand(
    MutableList<CommandPrefixOrSuffixItem> prefix,
    Word wordOrName,
    MutableList<CommandPrefixOrSuffixItem> suffix) {}
