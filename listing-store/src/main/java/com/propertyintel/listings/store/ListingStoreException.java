package com.propertyintel.listings.store;

/**
 * Base of the failure kinds the stores surface. Callers decide on retry by
 * subtype: only {@link StorageUnavailableException} is safe to retry. A
 * {@link ConstraintViolationException} is a bug in the calling sequence and an
 * {@link InvalidStoreOperationException} a schema or deployment problem.
 */
public abstract class ListingStoreException extends RuntimeException {

    protected ListingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
