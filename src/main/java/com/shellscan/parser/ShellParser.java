package com.shellscan.parser;

import com.shellscan.syntax.Program;

// Blank and comment-only text parses to an empty program
public class ShellParser {

    public Program parse(String text) throws ShellParseException {
        return new ShellGrammar(new ShellTokenizer(text).tokenize(), 0).program();
    }
}
