package com.github.musiKk.ast;

import java.util.List;
import java.util.Objects;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

public sealed interface Type permits Type.Builtin, Type.Identifier, Type.Function, Type.Array {

    <R, A> R accept(Visitor<R, A> visitor, A arg);

    interface Visitor<R, A> {
        R visitBuiltin(Builtin builtin, A arg);
        R visitIdentifier(Identifier identifier, A arg);
        R visitFunction(Function function, A arg);
        R visitArray(Array array, A arg);
    }

    @RequiredArgsConstructor
    enum Builtin implements Type {
        U8("U8"), U16("U16"), U32("U32"), U64("U64"),
        I8("I8"), I16("I16"), I32("I32"), I64("I64"),
        F32("F32"), F64("F64"),
        BOOLEAN("Boolean"),
        CHARACTER("Character"),
        /**
         * Return type of functions that produce no value. Its single value {@code nil} is
         * only valid where a {@code Nil} is expected; producers keep it in return position.
         */
        NIL("Nil");

        @Accessors(fluent = true)
        @Getter
        private final String displayName;

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visitBuiltin(this, arg);
        }
    }

    /** A named type, generic when {@code generics} is non-empty. */
    record Identifier(String name, List<Type> generics) implements Type {
        public Identifier {
            Objects.requireNonNull(name);
            generics = List.copyOf(generics);
        }
        public Identifier(String name) {
            this(name, List.of());
        }
        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visitIdentifier(this, arg);
        }
    }

    record Function(List<Type> parameters, Type returnType) implements Type {
        public Function {
            parameters = List.copyOf(parameters);
            Objects.requireNonNull(returnType);
        }
        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visitFunction(this, arg);
        }
    }

    record Array(Type elementType) implements Type {
        public Array {
            Objects.requireNonNull(elementType);
        }
        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visitArray(this, arg);
        }
    }
}
