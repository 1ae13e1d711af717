package com.quarry.query.split;

import com.quarry.storage.ColumnSet;
import com.quarry.storage.StorageConfigurationException;

import java.util.List;
import java.util.Objects;

/**
 * The three columns that identify a row well enough for two-phase column splitting
 */
public final class ColumnSplitSpec {

    private final String idColumn;
    private final String projectColumn;
    private final String timestampColumn;

    public ColumnSplitSpec(String idColumn, String projectColumn, String timestampColumn) {
        this.idColumn = Objects.requireNonNull(idColumn, "idColumn");
        this.projectColumn = Objects.requireNonNull(projectColumn, "projectColumn");
        this.timestampColumn = Objects.requireNonNull(timestampColumn, "timestampColumn");
    }

    public String getIdColumn() {
        return idColumn;
    }

    public String getProjectColumn() {
        return projectColumn;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    /**
     * Minimal projection: id, project, timestamp
     */
    public List<String> getMinColumns() {
        return List.of(idColumn, projectColumn, timestampColumn);
    }

    /**
     * @throws StorageConfigurationException if any of the three columns is missing from {@code columns}
     */
    public ColumnSplitSpec validate(ColumnSet columns) {
        for (String column : getMinColumns()) {
            if (!columns.contains(column)) {
                throw new StorageConfigurationException("Column split spec refers to unknown column " + column);
            }
        }
        return this;
    }

    @Override
    public String toString() {
        return "ColumnSplitSpec{" + idColumn + ", " + projectColumn + ", " + timestampColumn + "}";
    }
}
