package com.bookcatalog.service.cache;

import com.bookcatalog.config.CatalogProperties;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.dto.response.PagedResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** One Caffeine cache per {@link Variant}, each with its own expiry. */
@Component
public class ListPageCache {

    private static final Logger log = LoggerFactory.getLogger(ListPageCache.class);

    public enum Variant {
        ASYNCHRONOUS("asynchronous"),
        SYNCHRONOUS("synchronous");

        private final String keyPrefix;

        Variant(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public String keyPrefix() {
            return keyPrefix;
        }
    }

    private final Map<Variant, Cache<String, PagedResponse<BookResponse>>> caches = new EnumMap<>(Variant.class);

    @Autowired
    public ListPageCache(CatalogProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    public ListPageCache(CatalogProperties properties, Ticker ticker) {
        CatalogProperties.Cache settings = properties.cache();
        caches.put(Variant.ASYNCHRONOUS, build(settings.asynchronousExpiry(), settings.maximumSize(), ticker));
        caches.put(Variant.SYNCHRONOUS, build(settings.synchronousExpiry(), settings.maximumSize(), ticker));
    }

    private static Cache<String, PagedResponse<BookResponse>> build(Duration expiry, long maximumSize,
                                                                  Ticker ticker) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .recordStats();
        if (expiry != null) {
            builder.expireAfterWrite(expiry);
        }
        return builder.build();
    }

    public static String key(Variant variant, int page, int orderBy, String filter) {
        return variant.keyPrefix() + "?page=" + page + "&orderBy=" + orderBy + "&filter=" + filter;
    }

    public Optional<PagedResponse<BookResponse>> get(Variant variant, String key) {
        PagedResponse<BookResponse> cached = caches.get(variant).getIfPresent(key);
        if (cached != null) {
            log.debug("List page cache hit for {}", key);
        }
        return Optional.ofNullable(cached);
    }

    public void put(Variant variant, String key, PagedResponse<BookResponse> page) {
        caches.get(variant).put(key, page);
    }

    public void invalidateAll() {
        caches.values().forEach(Cache::invalidateAll);
    }
}
