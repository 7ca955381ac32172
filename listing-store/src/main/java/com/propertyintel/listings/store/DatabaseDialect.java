package com.propertyintel.listings.store;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.util.Locale;

/**
 * SQL flavour of the connected database. Production runs on PostgreSQL;
 * H2 is only used by the tests.
 */
@Slf4j
public enum DatabaseDialect {

    POSTGRES {
        @Override
        public String jsonColumnType() {
            return "JSONB";
        }

        @Override
        public String jsonParam(String name) {
            return "CAST(:" + name + " AS JSONB)";
        }
    },

    H2 {
        @Override
        public String jsonColumnType() {
            return "VARCHAR";
        }

        @Override
        public String jsonParam(String name) {
            return ":" + name;
        }
    };

    public abstract String jsonColumnType();

    /** Named parameter expression for a JSON string bound as VARCHAR */
    public abstract String jsonParam(String name);

    public boolean isPostgres() {
        return this == POSTGRES;
    }

    public static DatabaseDialect detect(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String url = metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return H2;
            }
            String productName = metaData.getDatabaseProductName();
            if (productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres")) {
                return POSTGRES;
            }
            log.warn("Unsupported database '{}', falling back to PostgreSQL dialect", productName);
            return POSTGRES;
        } catch (Exception e) {
            throw new StorageUnavailableException("Unable to detect database dialect: " + e.getMessage(), e);
        }
    }
}
