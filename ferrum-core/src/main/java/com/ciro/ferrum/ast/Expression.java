package com.ciro.ferrum.ast;

import java.util.List;
import java.util.Objects;

/**
 * Expresiones del DSL modeladas como forma de árbol.
 * Nunca se evalúan: solo sirven para imprimirlas de forma canónica.
 */
public interface Expression {

    <R> R accept(Visitor<R> visitor);

    record StringLiteral(String value) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    record NumberLiteral(double value) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record SignalAccess(String signal) implements Expression {
        public SignalAccess {
            Objects.requireNonNull(signal, "signal must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSignal(this);
        }
    }

    record PropertyAccess(String signal, String property) implements Expression {
        public PropertyAccess {
            Objects.requireNonNull(signal, "signal must not be null");
            Objects.requireNonNull(property, "property must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProperty(this);
        }
    }

    record BinaryOperation(Expression left, BinaryOperator operator, Expression right) implements Expression {
        public BinaryOperation {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record FunctionCall(String function, List<Expression> args) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(function, "function must not be null");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    interface Visitor<R> {
        R visitString(StringLiteral literal);
        R visitNumber(NumberLiteral literal);
        R visitSignal(SignalAccess access);
        R visitProperty(PropertyAccess access);
        R visitBinary(BinaryOperation operation);
        R visitCall(FunctionCall call);
    }
}
