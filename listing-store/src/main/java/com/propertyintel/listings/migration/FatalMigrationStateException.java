package com.propertyintel.listings.migration;

/**
 * Cutover failed part-way. Never retried: an operator has to inspect the
 * database (or restore the backup) before anything else touches these tables.
 */
public class FatalMigrationStateException extends RuntimeException {

    public FatalMigrationStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
