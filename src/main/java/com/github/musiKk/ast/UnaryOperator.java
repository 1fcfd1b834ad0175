package com.github.musiKk.ast;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

@RequiredArgsConstructor
public enum UnaryOperator {
    NEGATE("-"),
    NOT("!");

    @Accessors(fluent = true)
    @Getter
    private final String symbol;
}
