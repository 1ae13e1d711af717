package com.quarry.dataset;

import com.quarry.query.Query;
import com.quarry.query.RequestSettings;
import com.quarry.storage.ReadableStorage;
import com.quarry.storage.StorageSelector;

/**
 * Reads from the hourly rollup when the requested granularity is a whole number of
 * hours, from the raw sessions otherwise. A query without granularity is hourly.
 */
public class SessionsStorageSelector implements StorageSelector {

    static final int HOUR_SECONDS = 3600;

    private final ReadableStorage rawStorage;
    private final ReadableStorage hourlyStorage;

    public SessionsStorageSelector(ReadableStorage rawStorage, ReadableStorage hourlyStorage) {
        this.rawStorage = rawStorage;
        this.hourlyStorage = hourlyStorage;
    }

    @Override
    public ReadableStorage selectStorage(Query query, RequestSettings settings) {
        int granularity = query.getGranularity() != null ? query.getGranularity() : HOUR_SECONDS;
        if (granularity >= HOUR_SECONDS && granularity % HOUR_SECONDS == 0) {
            return hourlyStorage;
        }
        return rawStorage;
    }
}
