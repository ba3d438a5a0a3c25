package com.ciro.ferrum.format;

import com.ciro.ferrum.ast.Expression;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Imprime expresiones con sintaxis infija/llamada convencional.
 * Solo agrega paréntesis cuando la precedencia lo exige (asociatividad izquierda).
 */
public final class ExpressionPrinter implements Expression.Visitor<String> {

    public static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    private ExpressionPrinter() {}

    public static String print(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitString(Expression.StringLiteral literal) {
        return "\"" + literal.value() + "\"";
    }

    @Override
    public String visitNumber(Expression.NumberLiteral literal) {
        double v = literal.value();
        if (Double.isNaN(v) || Double.isInfinite(v)) return Double.toString(v);
        if (v == Math.rint(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    @Override
    public String visitSignal(Expression.SignalAccess access) {
        return access.signal();
    }

    @Override
    public String visitProperty(Expression.PropertyAccess access) {
        return access.signal() + "." + access.property();
    }

    @Override
    public String visitBinary(Expression.BinaryOperation operation) {
        int precedence = operation.operator().precedence();
        return operand(operation.left(), precedence, false)
                + " " + operation.operator().symbol() + " "
                + operand(operation.right(), precedence, true);
    }

    @Override
    public String visitCall(Expression.FunctionCall call) {
        return call.function() + "(" + call.args().stream()
                .map(ExpressionPrinter::print)
                .collect(Collectors.joining(", ")) + ")";
    }

    private String operand(Expression e, int parentPrecedence, boolean rightSide) {
        String printed = e.accept(this);
        if (e instanceof Expression.BinaryOperation inner) {
            int p = inner.operator().precedence();
            if (p < parentPrecedence || (rightSide && p == parentPrecedence)) {
                return "(" + printed + ")";
            }
        }
        return printed;
    }
}
