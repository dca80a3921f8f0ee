package com.shellscan.syntax;

public record ProcessSubstitution(Kind kind, CompoundList list, String text) {

    public enum Kind {
        READ("<"),
        WRITE(">");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
