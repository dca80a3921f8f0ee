package com.shellscan.syntax;

public sealed interface ExtendedTestExpr {
    record Not(ExtendedTestExpr inner) implements ExtendedTestExpr {}
    record And(ExtendedTestExpr left, ExtendedTestExpr right) implements ExtendedTestExpr {}
    record Or(ExtendedTestExpr left, ExtendedTestExpr right) implements ExtendedTestExpr {}
    record Parenthesized(ExtendedTestExpr inner) implements ExtendedTestExpr {}
    record UnaryTest(String operator, Word operand) implements ExtendedTestExpr {}
    record BinaryTest(String operator, Word left, Word right) implements ExtendedTestExpr {}
}
