package com.propertyintel.listings.store;

/**
 * The database rejected the statement for a reason a retry cannot fix: a missing
 * table or column, bad SQL, insufficient privileges. Usually a category still on
 * its legacy flat tables or a schema that was never created.
 */
public class InvalidStoreOperationException extends ListingStoreException {

    public InvalidStoreOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
