package com.propertyintel.listings.store;

/**
 * Transient persistence failure. Every write is idempotent, so the same call
 * can be repeated with the same inputs.
 */
public class StorageUnavailableException extends ListingStoreException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
