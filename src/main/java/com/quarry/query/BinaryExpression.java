package com.quarry.query;

import java.util.Objects;
import java.util.Set;

/**
 * Represents a binary expression (AND/OR) over two sub-expressions
 */
public final class BinaryExpression implements Expression {

    public static final String AND = "AND";
    public static final String OR = "OR";

    private final String operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpression(String operator, Expression left, Expression right) {
        if (!AND.equals(operator) && !OR.equals(operator)) {
            throw new IllegalArgumentException("Unsupported boolean operator: " + operator);
        }
        this.operator = operator;
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(OR, left, right);
    }

    public String getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public void collectColumns(Set<String> columns) {
        left.collectColumns(columns);
        right.collectColumns(columns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinaryExpression)) {
            return false;
        }
        BinaryExpression that = (BinaryExpression) o;
        return operator.equals(that.operator) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
