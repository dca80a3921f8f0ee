package com.shellscan.syntax;

public sealed interface IoRedirect {
    record File(Integer fd, Kind kind, Target target) implements IoRedirect {}

    record HereDocument(Integer fd, boolean removeTabs, boolean requiresExpansion, Word hereEnd, Word doc)
        implements IoRedirect {}

    record HereString(Integer fd, Word word) implements IoRedirect {}
    record OutputAndError(Word word, boolean append) implements IoRedirect {}

    sealed interface Target {
        record Filename(Word word) implements Target {}
        record Fd(int fd) implements Target {}
        record Substitution(ProcessSubstitution substitution) implements Target {}
    }

    enum Kind {
        READ("<"),
        WRITE(">"),
        APPEND(">>"),
        READ_AND_WRITE("<>"),
        CLOBBER(">|"),
        DUPLICATE_INPUT("<&"),
        DUPLICATE_OUTPUT(">&");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isDuplicate() {
            return this == DUPLICATE_INPUT || this == DUPLICATE_OUTPUT;
        }

        public static Kind fromSymbol(String symbol) {
            for (Kind kind : values()) {
                if (kind.symbol.equals(symbol)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Not a file redirect operator: " + symbol);
        }
    }
}
