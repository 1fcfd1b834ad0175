package com.github.musiKk.ast.printer;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.stream.Collectors;

import com.github.musiKk.ast.Program;
import com.github.musiKk.ast.Program.ArrayExpression;
import com.github.musiKk.ast.Program.AssignmentExpression;
import com.github.musiKk.ast.Program.BinaryExpression;
import com.github.musiKk.ast.Program.BlockExpression;
import com.github.musiKk.ast.Program.BooleanExpression;
import com.github.musiKk.ast.Program.BreakStatement;
import com.github.musiKk.ast.Program.CharacterExpression;
import com.github.musiKk.ast.Program.ContinueStatement;
import com.github.musiKk.ast.Program.Declaration;
import com.github.musiKk.ast.Program.Expression;
import com.github.musiKk.ast.Program.ExpressionStatement;
import com.github.musiKk.ast.Program.FunctionCallExpression;
import com.github.musiKk.ast.Program.FunctionDeclaration;
import com.github.musiKk.ast.Program.IfExpression;
import com.github.musiKk.ast.Program.ImportDeclaration;
import com.github.musiKk.ast.Program.InfiniteLoop;
import com.github.musiKk.ast.Program.IteratorLoop;
import com.github.musiKk.ast.Program.LoopExpression;
import com.github.musiKk.ast.Program.LoopType;
import com.github.musiKk.ast.Program.MemberAccessExpression;
import com.github.musiKk.ast.Program.NumberExpression;
import com.github.musiKk.ast.Program.ReturnStatement;
import com.github.musiKk.ast.Program.Statement;
import com.github.musiKk.ast.Program.StringExpression;
import com.github.musiKk.ast.Program.StructCreationExpression;
import com.github.musiKk.ast.Program.StructDeclaration;
import com.github.musiKk.ast.Program.StructElement;
import com.github.musiKk.ast.Program.StructField;
import com.github.musiKk.ast.Program.TypeDeclaration;
import com.github.musiKk.ast.Program.UnaryExpression;
import com.github.musiKk.ast.Program.VariableDeclaration;
import com.github.musiKk.ast.Program.VariableExpression;
import com.github.musiKk.ast.Program.WhileLoop;
import com.github.musiKk.ast.Type;

import lombok.extern.slf4j.Slf4j;

/**
 * Renders a syntax tree as indented, ANSI-highlighted text, one node per line.
 * <p>
 * Each line starts with a gray {@code "|  "} guide per nesting level. The text before the
 * first colon of a line is printed bold; a line without a colon is bold as a whole. The
 * output is part of the snapshot format and must stay byte-for-byte stable.
 * <p>
 * The nesting depth is passed down the traversal, so an instance holds no per-call state.
 */
@Slf4j
public class AstPrinter {

    static final String INDENT = "|  ";

    private final DeclarationPrinter declarationPrinter = new DeclarationPrinter();
    private final StructElementPrinter structElementPrinter = new StructElementPrinter();
    private final StatementPrinter statementPrinter = new StatementPrinter();
    private final ExpressionPrinter expressionPrinter = new ExpressionPrinter();
    private final LoopPrinter loopPrinter = new LoopPrinter();
    private final TypePrinter typePrinter = new TypePrinter();

    public String printProgram(Program program) {
        log.debug("printing program with {} declarations", program.declarations().size());
        var output = new StringBuilder();
        for (var declaration : program.declarations()) {
            output.append(declaration(declaration, 0));
        }
        log.trace("printed {} characters", output.length());
        return output.toString();
    }

    public String printDeclaration(Declaration declaration) {
        return declaration(declaration, 0);
    }

    public String printStatement(Statement statement) {
        return statement(statement, 0);
    }

    public String printExpression(Expression expression) {
        return expression(expression, 0);
    }

    public String printType(Type type) {
        return type(type, 0);
    }

    private String declaration(Declaration declaration, int depth) {
        return declaration.accept(declarationPrinter, depth);
    }

    private String statement(Statement statement, int depth) {
        return statement.accept(statementPrinter, depth);
    }

    private String expression(Expression expression, int depth) {
        return expression.accept(expressionPrinter, depth);
    }

    private String type(Type type, int depth) {
        return type.accept(typePrinter, depth);
    }

    static String line(int depth, String content) {
        var output = new StringBuilder();
        output.append(Ansi.GRAY.code());
        for (int i = 0; i < depth; i++) {
            output.append(INDENT);
        }
        output.append(Ansi.RESET.code());

        int colon = content.indexOf(':');
        String header = colon < 0 ? content : content.substring(0, colon);
        output.append(Ansi.BOLD.code()).append(header).append(Ansi.RESET.code());
        if (colon >= 0) {
            output.append(content, colon, content.length());
        }
        return output.toString();
    }

    // shortest round-trip digits, never in exponent form
    static String formatNumber(double number) {
        if (Double.isNaN(number)) {
            return "NaN";
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? "inf" : "-inf";
        }
        if (number == 0) {
            return Double.doubleToRawLongBits(number) < 0 ? "-0" : "0";
        }
        var exact = new BigDecimal(number);
        for (int precision = 1; precision < 17; precision++) {
            var rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == number) {
                return rounded.stripTrailingZeros().toPlainString();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros().toPlainString();
    }

    private class DeclarationPrinter implements Declaration.Visitor<String, Integer> {

        @Override
        public String visitFunction(FunctionDeclaration function, Integer depth) {
            var output = new StringBuilder(line(depth, "Function: " + function.name() + "\n"));
            int inner = depth + 1;
            output.append(line(inner, "Parameters:\n"));
            for (var parameter : function.parameters()) {
                output.append(line(inner, "- " + parameter.name() + ": " + type(parameter.type(), inner) + "\n"));
            }
            output.append(line(inner, "Return Type: " + type(function.returnType(), inner) + "\n"));
            output.append(line(inner, "Body: "));
            output.append(expression(function.body(), inner));
            return output.toString();
        }

        @Override
        public String visitStruct(StructDeclaration struct, Integer depth) {
            var output = new StringBuilder(line(depth, "Struct: " + struct.name() + "\n"));
            int inner = depth + 1;
            output.append(line(inner, "Elements:\n"));
            for (var element : struct.elements()) {
                output.append(element.accept(structElementPrinter, inner));
            }
            return output.toString();
        }

        @Override
        public String visitTypeDeclaration(TypeDeclaration typeDeclaration, Integer depth) {
            var output = new StringBuilder(line(depth, "Type Declaration: " + typeDeclaration.name() + "\n"));
            int inner = depth + 1;
            output.append(line(inner, "Alias: " + type(typeDeclaration.alias(), inner) + "\n"));
            if (!typeDeclaration.genericParameters().isEmpty()) {
                output.append(line(inner, "Generic Arguments:\n"));
                for (var parameter : typeDeclaration.genericParameters()) {
                    output.append(line(inner, "- " + parameter + "\n"));
                }
            }
            return output.toString();
        }

        @Override
        public String visitImport(ImportDeclaration importDeclaration, Integer depth) {
            return line(depth, "Import: " + String.join(".", importDeclaration.path()) + "\n");
        }
    }

    private class StructElementPrinter implements StructElement.Visitor<String, Integer> {

        @Override
        public String visitDeclaration(Declaration declaration, Integer depth) {
            return declaration(declaration, depth);
        }

        @Override
        public String visitField(StructField field, Integer depth) {
            return line(depth, "- " + field.name() + ": " + type(field.type(), depth) + "\n");
        }
    }

    private class StatementPrinter implements Statement.Visitor<String, Integer> {

        @Override
        public String visitDeclaration(Declaration declaration, Integer depth) {
            return declaration(declaration, depth);
        }

        @Override
        public String visitExpression(ExpressionStatement statement, Integer depth) {
            var output = new StringBuilder(line(depth, "Expression:\n"));
            output.append(expression(statement.expression(), depth + 1));
            if (statement.result()) {
                output.append(line(depth + 1, "Result: true\n"));
            }
            return output.toString();
        }

        @Override
        public String visitVariableDeclaration(VariableDeclaration declaration, Integer depth) {
            var output = new StringBuilder(line(depth, "Variable Declaration: " + declaration.name() + "\n"));
            int inner = depth + 1;
            output.append(line(inner, "Mutability: " + declaration.mutability().displayName() + "\n"));
            output.append(line(inner, "Type: " + type(declaration.type(), inner) + "\n"));
            output.append(line(inner, "Value:\n"));
            output.append(expression(declaration.value(), inner));
            return output.toString();
        }

        @Override
        public String visitBreak(BreakStatement statement, Integer depth) {
            return line(depth, "Break\n");
        }

        @Override
        public String visitContinue(ContinueStatement statement, Integer depth) {
            return line(depth, "Continue\n");
        }

        @Override
        public String visitReturn(ReturnStatement statement, Integer depth) {
            var output = new StringBuilder(line(depth, "Return:\n"));
            output.append(statement.value()
                    .map(value -> expression(value, depth + 1))
                    .orElseGet(() -> line(depth + 1, "No value\n")));
            return output.toString();
        }
    }

    private class ExpressionPrinter implements Expression.Visitor<String, Integer> {

        @Override
        public String visitBlock(BlockExpression block, Integer depth) {
            var output = new StringBuilder(line(depth, "Block:\n"));
            for (var statement : block.statements()) {
                output.append(statement(statement, depth + 1));
            }
            return output.toString();
        }

        @Override
        public String visitNumber(NumberExpression number, Integer depth) {
            return line(depth, "Number Literal: " + formatNumber(number.number()) + "\n");
        }

        @Override
        public String visitString(StringExpression string, Integer depth) {
            return line(depth, "String Literal: " + string.string() + "\n");
        }

        @Override
        public String visitCharacter(CharacterExpression character, Integer depth) {
            return line(depth, "Character Literal: " + Character.toString(character.codePoint()) + "\n");
        }

        @Override
        public String visitBoolean(BooleanExpression bool, Integer depth) {
            return line(depth, "Boolean Literal: " + bool.value() + "\n");
        }

        @Override
        public String visitVariable(VariableExpression variable, Integer depth) {
            return line(depth, "Variable: " + variable.name() + "\n");
        }

        @Override
        public String visitFunctionCall(FunctionCallExpression call, Integer depth) {
            var output = new StringBuilder(line(depth, "Function Call\n"));
            int inner = depth + 1;
            output.append(line(inner, "Callee:\n"));
            output.append(expression(call.callee(), inner));
            output.append(line(inner, "Arguments:\n"));
            for (var argument : call.arguments()) {
                output.append(expression(argument, inner));
            }
            return output.toString();
        }

        @Override
        public String visitBinary(BinaryExpression binary, Integer depth) {
            var output = new StringBuilder(line(depth, "Binary Operation: " + binary.operator().symbol() + "\n"));
            int inner = depth + 1;
            output.append(line(inner, "Left:\n"));
            output.append(expression(binary.left(), inner));
            output.append(line(inner, "Right:\n"));
            output.append(expression(binary.right(), inner));
            return output.toString();
        }

        @Override
        public String visitUnary(UnaryExpression unary, Integer depth) {
            var output = new StringBuilder(line(depth, "Unary Operation: " + unary.operator().symbol() + "\n"));
            output.append(line(depth + 1, "Operand:\n"));
            output.append(expression(unary.operand(), depth + 1));
            return output.toString();
        }

        @Override
        public String visitAssignment(AssignmentExpression assignment, Integer depth) {
            var output = new StringBuilder(line(depth, "Assignment:\n"));
            int inner = depth + 1;
            output.append(line(inner, "Variable: " + assignment.name() + "\n"));
            output.append(line(inner, "Value:\n"));
            output.append(expression(assignment.value(), inner));
            return output.toString();
        }

        @Override
        public String visitMemberAccess(MemberAccessExpression memberAccess, Integer depth) {
            var output = new StringBuilder(line(depth, "Member Access:\n"));
            int inner = depth + 1;
            output.append(line(inner, "Object:\n"));
            output.append(expression(memberAccess.object(), inner));
            output.append(line(inner, "Member: " + memberAccess.member() + "\n"));
            return output.toString();
        }

        @Override
        public String visitArray(ArrayExpression array, Integer depth) {
            var output = new StringBuilder(line(depth, "Array:\n"));
            int inner = depth + 1;
            output.append(line(inner, "Type: " + type(array.elementType(), inner) + "\n"));
            output.append(line(inner, "Size:\n"));
            output.append(expression(array.size(), inner));
            output.append(line(inner, "Initial Value:\n"));
            output.append(expression(array.initialValue(), inner));
            return output.toString();
        }

        @Override
        public String visitStructCreation(StructCreationExpression structCreation, Integer depth) {
            var output = new StringBuilder(line(depth, "Struct Creation:\n"));
            int inner = depth + 1;
            output.append(line(inner, "Type: " + type(structCreation.type(), inner) + "\n"));
            output.append(line(inner, "Fields:\n"));
            for (var field : structCreation.fields()) {
                output.append(line(inner, field.name() + ":\n"));
                output.append(expression(field.value(), inner + 1));
            }
            return output.toString();
        }

        @Override
        public String visitIf(IfExpression ifExpression, Integer depth) {
            var output = new StringBuilder(line(depth, "If Statement:\n"));
            int inner = depth + 1;
            output.append(line(inner, "Condition:\n"));
            output.append(expression(ifExpression.condition(), inner));
            output.append(line(inner, "Then Branch:\n"));
            output.append(expression(ifExpression.thenBranch(), inner));
            ifExpression.elseBranch().ifPresent(elseBranch -> {
                output.append(line(inner, "Else Branch:\n"));
                output.append(expression(elseBranch, inner));
            });
            return output.toString();
        }

        @Override
        public String visitLoop(LoopExpression loop, Integer depth) {
            return loop.loop().accept(loopPrinter, depth);
        }
    }

    private class LoopPrinter implements LoopType.Visitor<String, Integer> {

        @Override
        public String visitWhile(WhileLoop loop, Integer depth) {
            var output = new StringBuilder(line(depth, "While Loop:\n"));
            int inner = depth + 1;
            output.append(line(inner, "Condition:\n"));
            output.append(expression(loop.condition(), inner));
            output.append(line(inner, "Body: "));
            output.append(expression(loop.body(), inner));
            return output.toString();
        }

        @Override
        public String visitInfinite(InfiniteLoop loop, Integer depth) {
            var output = new StringBuilder(line(depth, "Infinite Loop:\n"));
            output.append(expression(loop.body(), depth + 1));
            return output.toString();
        }

        @Override
        public String visitIterator(IteratorLoop loop, Integer depth) {
            var output = new StringBuilder(line(depth, "Iterator Loop:\n"));
            int inner = depth + 1;
            output.append(line(inner, "Mutability: " + loop.mutability().displayName() + "\n"));
            output.append(line(inner, "Iterator: " + loop.iterator() + "\n"));
            output.append(line(inner, "Iterable:\n"));
            output.append(expression(loop.iterable(), inner));
            output.append(line(inner, "Body: "));
            output.append(expression(loop.body(), inner));
            return output.toString();
        }
    }

    private class TypePrinter implements Type.Visitor<String, Integer> {

        @Override
        public String visitBuiltin(Type.Builtin builtin, Integer depth) {
            return builtin.displayName();
        }

        @Override
        public String visitIdentifier(Type.Identifier identifier, Integer depth) {
            if (identifier.generics().isEmpty()) {
                return identifier.name();
            }
            return identifier.generics().stream()
                    .map(generic -> type(generic, depth))
                    .collect(Collectors.joining(", ", identifier.name() + "<", ">"));
        }

        // array and function types break out of the enclosing line onto their own lines
        @Override
        public String visitArray(Type.Array array, Integer depth) {
            return "\n" + line(depth, "Array of ") + type(array.elementType(), depth + 1);
        }

        @Override
        public String visitFunction(Type.Function function, Integer depth) {
            var output = new StringBuilder(line(depth, "Function:\n"));
            int inner = depth + 1;
            output.append(line(inner, "Parameters:\n"));
            for (var parameter : function.parameters()) {
                output.append(line(inner, "- " + type(parameter, inner) + "\n"));
            }
            output.append(line(inner, "Return Type: " + type(function.returnType(), inner) + "\n"));
            return output.toString();
        }
    }
}
