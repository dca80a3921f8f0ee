package com.shellscan.parser;

public class ShellParseException extends Exception {
    private final int offset;

    public ShellParseException(String message, int offset) {
        super(message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
