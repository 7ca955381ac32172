package com.propertyintel.listings.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.store.ContentFingerprinter;
import com.propertyintel.listings.store.DatabaseDialect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
public class StoreConfig {

    @Bean
    public DatabaseDialect databaseDialect(DataSource dataSource) {
        return DatabaseDialect.detect(dataSource);
    }

    @Bean
    public ContentFingerprinter contentFingerprinter(ObjectMapper objectMapper) {
        return new ContentFingerprinter(objectMapper);
    }
}
