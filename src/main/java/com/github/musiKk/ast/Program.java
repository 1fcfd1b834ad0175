package com.github.musiKk.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of every syntax tree: the declarations of one compiled unit, in source order.
 * <p>
 * All node kinds are records nested here. Each sealed family carries a {@code Visitor}
 * with one method per variant, so a new variant fails the build of every consumer
 * until it is handled.
 */
public record Program(List<Declaration> declarations) {

    public Program {
        declarations = List.copyOf(declarations);
    }

    // declarations

    public sealed interface Declaration extends Statement, StructElement {

        <R, A> R accept(Visitor<R, A> visitor, A arg);

        @Override
        default <R, A> R accept(Statement.Visitor<R, A> visitor, A arg) {
            return visitor.visitDeclaration(this, arg);
        }

        @Override
        default <R, A> R accept(StructElement.Visitor<R, A> visitor, A arg) {
            return visitor.visitDeclaration(this, arg);
        }

        interface Visitor<R, A> {
            R visitFunction(FunctionDeclaration function, A arg);
            R visitStruct(StructDeclaration struct, A arg);
            R visitTypeDeclaration(TypeDeclaration typeDeclaration, A arg);
            R visitImport(ImportDeclaration importDeclaration, A arg);
        }
    }

    public record FunctionDeclaration(
            String name,
            List<FunctionParameter> parameters,
            List<String> genericParameters,
            Type returnType,
            Expression body) implements Declaration {
        public FunctionDeclaration {
            Objects.requireNonNull(name);
            parameters = List.copyOf(parameters);
            genericParameters = List.copyOf(genericParameters);
            Objects.requireNonNull(returnType);
            Objects.requireNonNull(body);
        }
        public FunctionDeclaration(String name, List<FunctionParameter> parameters, Type returnType, Expression body) {
            this(name, parameters, List.of(), returnType, body);
        }
        @Override
        public <R, A> R accept(Declaration.Visitor<R, A> visitor, A arg) {
            return visitor.visitFunction(this, arg);
        }
    }

    public record FunctionParameter(String name, Type type) {
        public FunctionParameter {
            Objects.requireNonNull(name);
            Objects.requireNonNull(type);
        }
    }

    public record StructDeclaration(String name, List<StructElement> elements, List<String> genericParameters) implements Declaration {
        public StructDeclaration {
            Objects.requireNonNull(name);
            elements = List.copyOf(elements);
            genericParameters = List.copyOf(genericParameters);
        }
        public StructDeclaration(String name, List<StructElement> elements) {
            this(name, elements, List.of());
        }
        @Override
        public <R, A> R accept(Declaration.Visitor<R, A> visitor, A arg) {
            return visitor.visitStruct(this, arg);
        }
    }

    public record TypeDeclaration(String name, List<String> genericParameters, Type alias) implements Declaration {
        public TypeDeclaration {
            Objects.requireNonNull(name);
            genericParameters = List.copyOf(genericParameters);
            Objects.requireNonNull(alias);
        }
        public TypeDeclaration(String name, Type alias) {
            this(name, List.of(), alias);
        }
        @Override
        public <R, A> R accept(Declaration.Visitor<R, A> visitor, A arg) {
            return visitor.visitTypeDeclaration(this, arg);
        }
    }

    public record ImportDeclaration(List<String> path) implements Declaration {
        public ImportDeclaration {
            path = List.copyOf(path);
        }
        @Override
        public <R, A> R accept(Declaration.Visitor<R, A> visitor, A arg) {
            return visitor.visitImport(this, arg);
        }
    }

    // struct elements

    public sealed interface StructElement permits Declaration, StructField {

        <R, A> R accept(Visitor<R, A> visitor, A arg);

        interface Visitor<R, A> {
            R visitDeclaration(Declaration declaration, A arg);
            R visitField(StructField field, A arg);
        }
    }

    public record StructField(String name, Type type) implements StructElement {
        public StructField {
            Objects.requireNonNull(name);
            Objects.requireNonNull(type);
        }
        @Override
        public <R, A> R accept(StructElement.Visitor<R, A> visitor, A arg) {
            return visitor.visitField(this, arg);
        }
    }

    // statements

    public sealed interface Statement permits Declaration, ExpressionStatement, VariableDeclaration,
            BreakStatement, ContinueStatement, ReturnStatement {

        <R, A> R accept(Visitor<R, A> visitor, A arg);

        interface Visitor<R, A> {
            R visitDeclaration(Declaration declaration, A arg);
            R visitExpression(ExpressionStatement statement, A arg);
            R visitVariableDeclaration(VariableDeclaration declaration, A arg);
            R visitBreak(BreakStatement statement, A arg);
            R visitContinue(ContinueStatement statement, A arg);
            R visitReturn(ReturnStatement statement, A arg);
        }
    }

    /**
     * An expression in statement position. {@code result} marks the statement whose value
     * becomes the value of the enclosing block.
     */
    public record ExpressionStatement(Expression expression, boolean result) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(expression);
        }
        public ExpressionStatement(Expression expression) {
            this(expression, false);
        }
        @Override
        public <R, A> R accept(Statement.Visitor<R, A> visitor, A arg) {
            return visitor.visitExpression(this, arg);
        }
    }

    public record VariableDeclaration(VariableMutability mutability, String name, Type type, Expression value) implements Statement {
        public VariableDeclaration {
            Objects.requireNonNull(mutability);
            Objects.requireNonNull(name);
            Objects.requireNonNull(type);
            Objects.requireNonNull(value);
        }
        @Override
        public <R, A> R accept(Statement.Visitor<R, A> visitor, A arg) {
            return visitor.visitVariableDeclaration(this, arg);
        }
    }

    public record BreakStatement() implements Statement {
        @Override
        public <R, A> R accept(Statement.Visitor<R, A> visitor, A arg) {
            return visitor.visitBreak(this, arg);
        }
    }

    public record ContinueStatement() implements Statement {
        @Override
        public <R, A> R accept(Statement.Visitor<R, A> visitor, A arg) {
            return visitor.visitContinue(this, arg);
        }
    }

    public record ReturnStatement(Optional<Expression> value) implements Statement {
        public ReturnStatement {
            Objects.requireNonNull(value);
        }
        public ReturnStatement() {
            this(Optional.empty());
        }
        public ReturnStatement(Expression value) {
            this(Optional.of(value));
        }
        @Override
        public <R, A> R accept(Statement.Visitor<R, A> visitor, A arg) {
            return visitor.visitReturn(this, arg);
        }
    }

    // expressions

    public sealed interface Expression {

        <R, A> R accept(Visitor<R, A> visitor, A arg);

        interface Visitor<R, A> {
            R visitBlock(BlockExpression block, A arg);
            R visitNumber(NumberExpression number, A arg);
            R visitString(StringExpression string, A arg);
            R visitCharacter(CharacterExpression character, A arg);
            R visitBoolean(BooleanExpression bool, A arg);
            R visitVariable(VariableExpression variable, A arg);
            R visitFunctionCall(FunctionCallExpression call, A arg);
            R visitBinary(BinaryExpression binary, A arg);
            R visitUnary(UnaryExpression unary, A arg);
            R visitAssignment(AssignmentExpression assignment, A arg);
            R visitMemberAccess(MemberAccessExpression memberAccess, A arg);
            R visitArray(ArrayExpression array, A arg);
            R visitStructCreation(StructCreationExpression structCreation, A arg);
            R visitIf(IfExpression ifExpression, A arg);
            R visitLoop(LoopExpression loop, A arg);
        }
    }

    /** A block's value is the value of its statement flagged as result, if any. */
    public record BlockExpression(List<Statement> statements) implements Expression {
        public BlockExpression {
            statements = List.copyOf(statements);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitBlock(this, arg);
        }
    }

    public record NumberExpression(double number) implements Expression {
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitNumber(this, arg);
        }
    }

    public record StringExpression(String string) implements Expression {
        public StringExpression {
            Objects.requireNonNull(string);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitString(this, arg);
        }
    }

    public record CharacterExpression(int codePoint) implements Expression {
        public CharacterExpression {
            if (!Character.isValidCodePoint(codePoint)
                    || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
                throw new IllegalArgumentException("not a code point: " + codePoint);
            }
        }
        public static CharacterExpression of(char c) {
            return new CharacterExpression(c);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitCharacter(this, arg);
        }
    }

    public record BooleanExpression(boolean value) implements Expression {
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitBoolean(this, arg);
        }
    }

    public record VariableExpression(String name, ExpressionId id) implements Expression {
        public VariableExpression {
            Objects.requireNonNull(name);
            Objects.requireNonNull(id);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitVariable(this, arg);
        }
    }

    public record FunctionCallExpression(Expression callee, List<Expression> arguments) implements Expression {
        public FunctionCallExpression {
            Objects.requireNonNull(callee);
            arguments = List.copyOf(arguments);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitFunctionCall(this, arg);
        }
    }

    public record BinaryExpression(Expression left, BinaryOperator operator, Expression right) implements Expression {
        public BinaryExpression {
            Objects.requireNonNull(left);
            Objects.requireNonNull(operator);
            Objects.requireNonNull(right);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitBinary(this, arg);
        }
    }

    public record UnaryExpression(UnaryOperator operator, Expression operand) implements Expression {
        public UnaryExpression {
            Objects.requireNonNull(operator);
            Objects.requireNonNull(operand);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitUnary(this, arg);
        }
    }

    public record AssignmentExpression(String name, Expression value, ExpressionId id) implements Expression {
        public AssignmentExpression {
            Objects.requireNonNull(name);
            Objects.requireNonNull(value);
            Objects.requireNonNull(id);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitAssignment(this, arg);
        }
    }

    public record MemberAccessExpression(Expression object, String member) implements Expression {
        public MemberAccessExpression {
            Objects.requireNonNull(object);
            Objects.requireNonNull(member);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitMemberAccess(this, arg);
        }
    }

    /** Fixed-size array constructor: {@code size} copies of {@code initialValue}. */
    public record ArrayExpression(Type elementType, Expression size, Expression initialValue) implements Expression {
        public ArrayExpression {
            Objects.requireNonNull(elementType);
            Objects.requireNonNull(size);
            Objects.requireNonNull(initialValue);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitArray(this, arg);
        }
    }

    public record StructCreationExpression(Type type, List<FieldInitializer> fields) implements Expression {
        public StructCreationExpression {
            Objects.requireNonNull(type);
            fields = List.copyOf(fields);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitStructCreation(this, arg);
        }
    }

    public record FieldInitializer(String name, Expression value) {
        public FieldInitializer {
            Objects.requireNonNull(name);
            Objects.requireNonNull(value);
        }
    }

    public record IfExpression(Expression condition, Expression thenBranch, Optional<Expression> elseBranch) implements Expression {
        public IfExpression {
            Objects.requireNonNull(condition);
            Objects.requireNonNull(thenBranch);
            Objects.requireNonNull(elseBranch);
        }
        public IfExpression(Expression condition, Expression thenBranch) {
            this(condition, thenBranch, Optional.empty());
        }
        public IfExpression(Expression condition, Expression thenBranch, Expression elseBranch) {
            this(condition, thenBranch, Optional.of(elseBranch));
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitIf(this, arg);
        }
    }

    public record LoopExpression(LoopType loop) implements Expression {
        public LoopExpression {
            Objects.requireNonNull(loop);
        }
        @Override
        public <R, A> R accept(Expression.Visitor<R, A> visitor, A arg) {
            return visitor.visitLoop(this, arg);
        }
    }

    // loops

    public sealed interface LoopType {

        Expression body();

        <R, A> R accept(Visitor<R, A> visitor, A arg);

        interface Visitor<R, A> {
            R visitWhile(WhileLoop loop, A arg);
            R visitInfinite(InfiniteLoop loop, A arg);
            R visitIterator(IteratorLoop loop, A arg);
        }
    }

    public record WhileLoop(Expression condition, Expression body) implements LoopType {
        public WhileLoop {
            Objects.requireNonNull(condition);
            Objects.requireNonNull(body);
        }
        @Override
        public <R, A> R accept(LoopType.Visitor<R, A> visitor, A arg) {
            return visitor.visitWhile(this, arg);
        }
    }

    public record InfiniteLoop(Expression body) implements LoopType {
        public InfiniteLoop {
            Objects.requireNonNull(body);
        }
        @Override
        public <R, A> R accept(LoopType.Visitor<R, A> visitor, A arg) {
            return visitor.visitInfinite(this, arg);
        }
    }

    public record IteratorLoop(VariableMutability mutability, String iterator, Expression iterable, Expression body) implements LoopType {
        public IteratorLoop {
            Objects.requireNonNull(mutability);
            Objects.requireNonNull(iterator);
            Objects.requireNonNull(iterable);
            Objects.requireNonNull(body);
        }
        @Override
        public <R, A> R accept(LoopType.Visitor<R, A> visitor, A arg) {
            return visitor.visitIterator(this, arg);
        }
    }

}
