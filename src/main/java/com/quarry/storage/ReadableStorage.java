package com.quarry.storage;

import com.quarry.domain.StorageKey;
import com.quarry.query.processor.QueryProcessor;

import java.util.List;

/**
 * A storage queries can be sent to.
 *
 * Its query processors must be runnable regardless of the context the storage is
 * used in, alone or as one side of a join.
 */
public interface ReadableStorage {

    StorageKey getKey();

    TableSchema getReadSchema();

    List<QueryProcessor> getQueryProcessors();
}
