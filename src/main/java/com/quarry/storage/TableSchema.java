package com.quarry.storage;

import com.quarry.query.ComparisonExpression;

import java.util.List;
import java.util.Objects;

/**
 * Read schema of a ClickHouse table: where to read from and what the engine must know about it
 */
public final class TableSchema {

    private final String localTableName;
    private final String distTableName;
    private final ColumnSet columns;
    private final List<ComparisonExpression> mandatoryConditions;
    private final List<String> prewhereCandidates;

    public TableSchema(String localTableName, String distTableName, ColumnSet columns,
                       List<ComparisonExpression> mandatoryConditions, List<String> prewhereCandidates) {
        this.localTableName = Objects.requireNonNull(localTableName, "localTableName");
        this.distTableName = Objects.requireNonNull(distTableName, "distTableName");
        this.columns = Objects.requireNonNull(columns, "columns");
        this.mandatoryConditions = List.copyOf(mandatoryConditions);
        this.prewhereCandidates = List.copyOf(prewhereCandidates);
        for (ComparisonExpression condition : this.mandatoryConditions) {
            requireColumn(condition.getField(), "mandatory condition");
        }
        for (String candidate : this.prewhereCandidates) {
            requireColumn(candidate, "prewhere candidate");
        }
    }

    public String getLocalTableName() {
        return localTableName;
    }

    public String getDistTableName() {
        return distTableName;
    }

    /**
     * Physical source queries against this schema read from
     */
    public String getDataSource() {
        return distTableName;
    }

    public ColumnSet getColumns() {
        return columns;
    }

    /**
     * Conditions every query on this table must carry, e.g. {@code deleted = 0}
     */
    public List<ComparisonExpression> getMandatoryConditions() {
        return mandatoryConditions;
    }

    /**
     * Columns eligible for PREWHERE, most selective first
     */
    public List<String> getPrewhereCandidates() {
        return prewhereCandidates;
    }

    private void requireColumn(String column, String role) {
        if (!columns.contains(column)) {
            throw new StorageConfigurationException(
                "Column " + column + " used as " + role + " is not part of " + distTableName);
        }
    }
}
