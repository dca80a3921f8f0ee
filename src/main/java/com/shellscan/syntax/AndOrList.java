package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

public record AndOrList(Pipeline first, MutableList<AndOr> additional) {

    public record AndOr(Operator operator, Pipeline pipeline) {}

    public enum Operator {
        AND("&&"),
        OR("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
