package com.quarry.dataset;

import com.quarry.query.extension.ExtensionProcessor;
import com.quarry.query.plan.StorageQueryPlanBuilder;

import java.util.List;
import java.util.Objects;

/**
 * Logical, queryable view over one or more storages
 */
public class Dataset {

    private final String name;
    private final List<ExtensionProcessor> extensionProcessors;
    private final StorageQueryPlanBuilder planBuilder;

    public Dataset(String name, List<ExtensionProcessor> extensionProcessors, StorageQueryPlanBuilder planBuilder) {
        this.name = Objects.requireNonNull(name, "name");
        this.extensionProcessors = List.copyOf(extensionProcessors);
        this.planBuilder = Objects.requireNonNull(planBuilder, "planBuilder");
    }

    public String getName() {
        return name;
    }

    /**
     * Processors that turn request extensions into query conditions, applied in order
     */
    public List<ExtensionProcessor> getExtensionProcessors() {
        return extensionProcessors;
    }

    public StorageQueryPlanBuilder getPlanBuilder() {
        return planBuilder;
    }

    @Override
    public String toString() {
        return "Dataset{" + name + "}";
    }
}
