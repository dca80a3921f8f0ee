package com.shellscan.word;

import org.eclipse.collections.api.list.MutableList;

public sealed interface WordPiece {
    record Text(String value) implements WordPiece {}
    record SingleQuotedText(String value) implements WordPiece {}
    record AnsiCQuotedText(String value) implements WordPiece {}
    record EscapeSequence(String value) implements WordPiece {}
    record TildePrefix(String value) implements WordPiece {}
    record ParameterExpansion(String value) implements WordPiece {}
    record ArithmeticExpression(String value) implements WordPiece {}

    // Carry command text that is parsed again by the extractor
    record CommandSubstitution(String command) implements WordPiece {}
    record BackquotedCommandSubstitution(String command) implements WordPiece {}

    record DoubleQuotedSequence(MutableList<WordPiece> pieces) implements WordPiece {}
    record GettextDoubleQuotedSequence(MutableList<WordPiece> pieces) implements WordPiece {}
}
