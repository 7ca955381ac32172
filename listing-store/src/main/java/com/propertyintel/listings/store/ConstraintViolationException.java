package com.propertyintel.listings.store;

/**
 * A referential or ordering invariant was broken, e.g. a snapshot recorded
 * before its listing row exists. Never retried automatically.
 */
public class ConstraintViolationException extends ListingStoreException {

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
