package com.flowb.social.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fluent description of which rows of one table an operation applies to.
 * Used for reads as well as for patch and delete filters.
 */
public final class StoreQuery {

    private final String table;
    private final List<StoreFilter> filters = new ArrayList<>();
    private String orderColumn;
    private boolean ascending = true;
    private Integer limit;

    private StoreQuery(String table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public static StoreQuery from(String table) {
        return new StoreQuery(table);
    }

    public StoreQuery eq(String column, Object value) {
        return add(column, StoreFilter.Operator.EQ, value);
    }

    public StoreQuery neq(String column, Object value) {
        return add(column, StoreFilter.Operator.NEQ, value);
    }

    public StoreQuery in(String column, Collection<?> values) {
        return add(column, StoreFilter.Operator.IN, new ArrayList<>(values));
    }

    public StoreQuery notIn(String column, Collection<?> values) {
        return add(column, StoreFilter.Operator.NOT_IN, new ArrayList<>(values));
    }

    public StoreQuery gt(String column, Object value) {
        return add(column, StoreFilter.Operator.GT, value);
    }

    public StoreQuery gte(String column, Object value) {
        return add(column, StoreFilter.Operator.GTE, value);
    }

    public StoreQuery lt(String column, Object value) {
        return add(column, StoreFilter.Operator.LT, value);
    }

    public StoreQuery lte(String column, Object value) {
        return add(column, StoreFilter.Operator.LTE, value);
    }

    public StoreQuery isNull(String column) {
        return add(column, StoreFilter.Operator.IS_NULL, null);
    }

    public StoreQuery orderAsc(String column) {
        this.orderColumn = column;
        this.ascending = true;
        return this;
    }

    public StoreQuery orderDesc(String column) {
        this.orderColumn = column;
        this.ascending = false;
        return this;
    }

    public StoreQuery limit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.limit = limit;
        return this;
    }

    private StoreQuery add(String column, StoreFilter.Operator operator, Object value) {
        filters.add(new StoreFilter(column, operator, value));
        return this;
    }

    public String getTable() {
        return table;
    }

    public List<StoreFilter> getFilters() {
        return Collections.unmodifiableList(filters);
    }

    public String getOrderColumn() {
        return orderColumn;
    }

    public boolean isAscending() {
        return ascending;
    }

    public Integer getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "StoreQuery{" + table + " " + filters
                + (orderColumn != null ? " order " + orderColumn + (ascending ? " asc" : " desc") : "")
                + (limit != null ? " limit " + limit : "") + "}";
    }
}
