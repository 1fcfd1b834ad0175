package com.github.musiKk.ast;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Identifies one occurrence of a variable reference or assignment target, for binding
 * resolution after parsing. Carried by the tree but never printed.
 * <p>
 * {@code value} holds an unsigned 32-bit number: ids past {@code 2^31 - 1} are stored as
 * negative ints and read back with {@link #unsignedValue()}.
 */
public record ExpressionId(int value) {

    private static final AtomicInteger NEXT = new AtomicInteger();

    public static ExpressionId next() {
        return new ExpressionId(NEXT.getAndIncrement());
    }

    public long unsignedValue() {
        return Integer.toUnsignedLong(value);
    }

    @Override
    public String toString() {
        return "ExpressionId[value=" + Integer.toUnsignedString(value) + "]";
    }
}
