package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

public record CompoundList(MutableList<Item> items) {

    public record Item(AndOrList andOr, SeparatorOperator separator) {}

    public enum SeparatorOperator {
        SEQUENCE,
        ASYNC
    }
}
