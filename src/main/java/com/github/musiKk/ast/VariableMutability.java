package com.github.musiKk.ast;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

@RequiredArgsConstructor
public enum VariableMutability {
    MUTABLE("Mutable"),
    IMMUTABLE("Immutable");

    @Accessors(fluent = true)
    @Getter
    private final String displayName;
}
