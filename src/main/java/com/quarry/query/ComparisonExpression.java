package com.quarry.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Represents a comparison expression (field op literal).
 * A collection literal is copied into an unmodifiable list.
 */
public final class ComparisonExpression implements Expression {

    public static final String EQ = "=";
    public static final String GTE = ">=";
    public static final String LT = "<";
    public static final String IN = "IN";
    public static final String LIKE = "LIKE";

    private final String field;
    private final String operator;
    private final Object value;

    public ComparisonExpression(String field, String operator, Object value) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value instanceof Collection
            ? Collections.unmodifiableList(new ArrayList<>((Collection<?>) value))
            : value;
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    /**
     * True when this condition is on {@code field} with exactly {@code operator}
     */
    public boolean matches(String field, String operator) {
        return this.field.equals(field) && this.operator.equals(operator);
    }

    @Override
    public void collectColumns(Set<String> columns) {
        columns.add(field);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ComparisonExpression)) {
            return false;
        }
        ComparisonExpression that = (ComparisonExpression) o;
        return field.equals(that.field) && operator.equals(that.operator) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + value;
    }
}
