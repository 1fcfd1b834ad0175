package com.github.musiKk.ast.printer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

@RequiredArgsConstructor
enum Ansi {
    GRAY("\u001b[90m"),
    BOLD("\u001b[1m"),
    RESET("\u001b[0m");

    @Accessors(fluent = true)
    @Getter
    private final String code;
}
