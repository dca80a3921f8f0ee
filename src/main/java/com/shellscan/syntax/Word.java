package com.shellscan.syntax;

public record Word(String value) {}
