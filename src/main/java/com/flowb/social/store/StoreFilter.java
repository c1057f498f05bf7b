package com.flowb.social.store;

import java.util.Collection;
import java.util.Objects;

/**
 * A single column predicate. For {@link Operator#IN} and {@link Operator#NOT_IN}
 * the value is a collection, for {@link Operator#IS_NULL} it is ignored.
 */
public final class StoreFilter {

    public enum Operator {
        EQ("eq"),
        NEQ("neq"),
        IN("in"),
        NOT_IN("not.in"),
        GT("gt"),
        GTE("gte"),
        LT("lt"),
        LTE("lte"),
        IS_NULL("is");

        private final String token;

        Operator(String token) {
            this.token = token;
        }

        /**
         * Operator token as it appears in a PostgREST filter ({@code col=<token>.<value>}).
         */
        public String getToken() {
            return token;
        }
    }

    private final String column;
    private final Operator operator;
    private final Object value;

    StoreFilter(String column, Operator operator, Object value) {
        this.column = Objects.requireNonNull(column, "column");
        this.operator = Objects.requireNonNull(operator, "operator");
        if ((operator == Operator.IN || operator == Operator.NOT_IN) && !(value instanceof Collection)) {
            throw new IllegalArgumentException(operator + " filter on " + column + " needs a collection");
        }
        this.value = value;
    }

    public String getColumn() {
        return column;
    }

    public Operator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    @SuppressWarnings("unchecked")
    public Collection<Object> getValues() {
        return (Collection<Object>) value;
    }

    @Override
    public String toString() {
        return column + " " + operator.getToken() + " " + value;
    }
}
