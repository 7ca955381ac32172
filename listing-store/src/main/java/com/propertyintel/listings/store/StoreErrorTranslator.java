package com.propertyintel.listings.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.UncategorizedDataAccessException;

import java.util.function.Supplier;

/**
 * Narrows Spring's DataAccessException hierarchy to the store's failure kinds.
 */
@Slf4j
public final class StoreErrorTranslator {

    private StoreErrorTranslator() {
    }

    public static ListingStoreException translate(String operation, DataAccessException e) {
        if (e instanceof DataIntegrityViolationException) {
            log.error("{} violated a store constraint: {}", operation, e.getMessage());
            return new ConstraintViolationException(operation + " violated a store constraint", e);
        }
        if (isPermanent(e)) {
            log.error("{} rejected by the database: {}", operation, e.getMessage());
            return new InvalidStoreOperationException(operation + " rejected: " + e.getMessage(), e);
        }
        log.warn("{} failed, storage unavailable: {}", operation, e.getMessage());
        return new StorageUnavailableException(operation + " failed: " + e.getMessage(), e);
    }

    /**
     * Non-transient failures other than lost connections and uncategorised driver errors.
     */
    private static boolean isPermanent(DataAccessException e) {
        return e instanceof NonTransientDataAccessException
                && !(e instanceof DataAccessResourceFailureException)
                && !(e instanceof UncategorizedDataAccessException);
    }

    public static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw translate(operation, e);
        }
    }

    public static void run(String operation, Runnable action) {
        try {
            action.run();
        } catch (DataAccessException e) {
            throw translate(operation, e);
        }
    }
}
