package com.shellscan.syntax;

import org.eclipse.collections.api.list.MutableList;

public record Assignment(String name, Value value, boolean append) {

    public sealed interface Value {
        record Scalar(Word word) implements Value {}
        record Array(MutableList<ArrayElement> elements) implements Value {}
    }

    // index is null unless the element was written [index]=value
    public record ArrayElement(Word index, Word value) {}
}
