package com.enterprise.taskdistribution.exception;

/**
 * Exception thrown when a backing store cannot read or write a record
 */
public class PersistenceException extends TaskDistributionException {

    private final String storeName;

    public PersistenceException(String storeName, String message, Throwable cause) {
        super(storeName + ": " + message, cause);
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }
}
