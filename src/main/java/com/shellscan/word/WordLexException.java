package com.shellscan.word;

public class WordLexException extends Exception {
    public WordLexException(String message) {
        super(message);
    }
}
