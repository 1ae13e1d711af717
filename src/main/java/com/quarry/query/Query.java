package com.quarry.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Logical body of a request: projection, conditions, grouping, ordering and paging.
 *
 * The top-level condition list is an implicit AND. Conditions are addressed for
 * rewriting by exact (field, operator) match on that top level only.
 */
public class Query {
    private String dataSource;
    private List<String> selectedColumns;
    private List<Expression> conditions = new ArrayList<>();
    private List<Expression> prewhere = new ArrayList<>();
    private List<String> groupBy = new ArrayList<>();
    private List<Aggregation> aggregations = new ArrayList<>();
    private List<SortField> orderBy = new ArrayList<>();
    private Integer limit;
    private int offset;
    private Integer granularity;

    public Query() {
    }

    /**
     * Independent copy. Expressions, aggregations and sort fields are immutable
     * and shared, every list is fresh.
     */
    public Query copy() {
        Query copy = new Query();
        copy.dataSource = dataSource;
        copy.selectedColumns = selectedColumns != null ? new ArrayList<>(selectedColumns) : null;
        copy.conditions = new ArrayList<>(conditions);
        copy.prewhere = new ArrayList<>(prewhere);
        copy.groupBy = new ArrayList<>(groupBy);
        copy.aggregations = new ArrayList<>(aggregations);
        copy.orderBy = new ArrayList<>(orderBy);
        copy.limit = limit;
        copy.offset = offset;
        copy.granularity = granularity;
        return copy;
    }

    public String getDataSource() {
        return dataSource;
    }

    public void setDataSource(String dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Explicitly selected columns, null when the query selects none
     */
    public List<String> getSelectedColumns() {
        return selectedColumns;
    }

    public void setSelectedColumns(Collection<String> selectedColumns) {
        this.selectedColumns = selectedColumns != null ? new ArrayList<>(selectedColumns) : null;
    }

    public List<Expression> getConditions() {
        return conditions;
    }

    public void setConditions(Collection<? extends Expression> conditions) {
        this.conditions = new ArrayList<>(conditions);
    }

    public void addCondition(Expression condition) {
        this.conditions.add(condition);
    }

    public List<Expression> getPrewhere() {
        return prewhere;
    }

    public void setPrewhere(Collection<? extends Expression> prewhere) {
        this.prewhere = new ArrayList<>(prewhere);
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(Collection<String> groupBy) {
        this.groupBy = new ArrayList<>(groupBy);
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    public void setAggregations(Collection<Aggregation> aggregations) {
        this.aggregations = new ArrayList<>(aggregations);
    }

    public List<SortField> getOrderBy() {
        return orderBy;
    }

    public void setOrderBy(Collection<SortField> orderBy) {
        this.orderBy = new ArrayList<>(orderBy);
    }

    public Integer getLimit() {
        return limit;
    }

    /**
     * Limit with an absent value read as 0
     */
    public int getLimitOrZero() {
        return limit != null ? limit : 0;
    }

    public void setLimit(Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative, got " + limit);
        }
        this.limit = limit;
    }

    public int getOffset() {
        return offset;
    }

    public void setOffset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative, got " + offset);
        }
        this.offset = offset;
    }

    public Integer getGranularity() {
        return granularity;
    }

    public void setGranularity(Integer granularity) {
        this.granularity = granularity;
    }

    public boolean hasGroupBy() {
        return !groupBy.isEmpty();
    }

    public boolean hasAggregations() {
        return !aggregations.isEmpty();
    }

    /**
     * Every column the query reads, in first-seen order
     */
    public Set<String> getAllReferencedColumns() {
        Set<String> columns = new LinkedHashSet<>();
        if (selectedColumns != null) {
            columns.addAll(selectedColumns);
        }
        for (Aggregation aggregation : aggregations) {
            if (aggregation.getColumn() != null) {
                columns.add(aggregation.getColumn());
            }
        }
        columns.addAll(groupBy);
        for (Expression condition : conditions) {
            condition.collectColumns(columns);
        }
        for (Expression condition : prewhere) {
            condition.collectColumns(columns);
        }
        for (SortField sortField : orderBy) {
            columns.add(sortField.getField());
        }
        return columns;
    }

    /**
     * Literal of the first top-level condition on {@code field} with {@code operator}
     */
    public Optional<Object> findConditionValue(String field, String operator) {
        for (Expression condition : conditions) {
            if (condition instanceof ComparisonExpression
                    && ((ComparisonExpression) condition).matches(field, operator)) {
                return Optional.ofNullable(((ComparisonExpression) condition).getValue());
            }
        }
        return Optional.empty();
    }

    public boolean hasCondition(String field, String operator) {
        for (Expression condition : conditions) {
            if (condition instanceof ComparisonExpression
                    && ((ComparisonExpression) condition).matches(field, operator)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Swap the literal of every top-level condition on {@code field} with {@code operator},
     * in WHERE and in PREWHERE. Conditions that do not match, nested ones included, are
     * left untouched.
     *
     * @return number of conditions rewritten
     */
    public int replaceCondition(String field, String operator, Object newValue) {
        List<Expression> rewrittenConditions = new ArrayList<>(conditions.size());
        int replaced = rewriteMatching(conditions, rewrittenConditions, field, operator, newValue);
        List<Expression> rewrittenPrewhere = new ArrayList<>(prewhere.size());
        replaced += rewriteMatching(prewhere, rewrittenPrewhere, field, operator, newValue);
        this.conditions = rewrittenConditions;
        this.prewhere = rewrittenPrewhere;
        return replaced;
    }

    private static int rewriteMatching(List<Expression> source, List<Expression> target,
                                       String field, String operator, Object newValue) {
        int replaced = 0;
        for (Expression condition : source) {
            if (condition instanceof ComparisonExpression
                    && ((ComparisonExpression) condition).matches(field, operator)) {
                target.add(new ComparisonExpression(field, operator, newValue));
                replaced++;
            } else {
                target.add(condition);
            }
        }
        return replaced;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Query)) {
            return false;
        }
        Query that = (Query) o;
        return offset == that.offset
            && Objects.equals(dataSource, that.dataSource)
            && Objects.equals(selectedColumns, that.selectedColumns)
            && conditions.equals(that.conditions)
            && prewhere.equals(that.prewhere)
            && groupBy.equals(that.groupBy)
            && aggregations.equals(that.aggregations)
            && orderBy.equals(that.orderBy)
            && Objects.equals(limit, that.limit)
            && Objects.equals(granularity, that.granularity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, selectedColumns, conditions, groupBy, orderBy, limit, offset);
    }

    @Override
    public String toString() {
        return "Query{dataSource=" + dataSource
            + ", selected=" + selectedColumns
            + ", conditions=" + conditions
            + ", groupBy=" + groupBy
            + ", orderBy=" + orderBy
            + ", limit=" + limit
            + ", offset=" + offset + "}";
    }
}
