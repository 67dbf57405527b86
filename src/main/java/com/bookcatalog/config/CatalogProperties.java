package com.bookcatalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "catalog")
public record CatalogProperties(
    @DefaultValue("10s") Duration queryTimeout,
    @DefaultValue("10") int pageSize,
    @DefaultValue Cache cache
) {

    public CatalogProperties {
        if (queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new IllegalArgumentException("catalog.query-timeout must be positive");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("catalog.page-size must be positive");
        }
    }

    public record Cache(
        Duration asynchronousExpiry,
        @DefaultValue("5s") Duration synchronousExpiry,
        @DefaultValue("1000") long maximumSize
    ) {}
}
