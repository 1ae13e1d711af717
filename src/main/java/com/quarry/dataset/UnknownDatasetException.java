package com.quarry.dataset;

/**
 * Exception thrown when a request names a dataset that is not registered
 */
public class UnknownDatasetException extends RuntimeException {

    private final String datasetName;

    public UnknownDatasetException(String datasetName) {
        super("Unknown dataset: " + datasetName);
        this.datasetName = datasetName;
    }

    public String getDatasetName() {
        return datasetName;
    }
}
