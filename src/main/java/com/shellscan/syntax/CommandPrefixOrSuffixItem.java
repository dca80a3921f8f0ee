package com.shellscan.syntax;

public sealed interface CommandPrefixOrSuffixItem {
    record Redirect(IoRedirect redirect) implements CommandPrefixOrSuffixItem {}
    record AssignmentWord(Assignment assignment, Word word) implements CommandPrefixOrSuffixItem {}
    record WordItem(Word word) implements CommandPrefixOrSuffixItem {}
    record Substitution(ProcessSubstitution substitution) implements CommandPrefixOrSuffixItem {}
}
