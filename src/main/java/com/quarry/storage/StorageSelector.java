package com.quarry.storage;

import com.quarry.query.Query;
import com.quarry.query.RequestSettings;

/**
 * Picks one of several storages of a dataset for a query.
 * Pure function of the query and settings.
 */
@FunctionalInterface
public interface StorageSelector {

    ReadableStorage selectStorage(Query query, RequestSettings settings);
}
