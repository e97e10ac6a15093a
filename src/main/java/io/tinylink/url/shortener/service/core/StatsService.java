package io.tinylink.url.shortener.service.core;

import io.tinylink.url.shortener.service.exception.UrlNotFoundException;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import io.tinylink.url.shortener.service.store.UrlStore;
import org.springframework.stereotype.Service;

@Service
public class StatsService {

    private final UrlStore store;

    public StatsService(UrlStore store) {
        this.store = store;
    }

    public ShortUrlRecord stats(String shortCode) {
        if (!ShortCodeGenerator.isWellFormed(shortCode)) {
            throw new UrlNotFoundException(shortCode);
        }
        return store.get(shortCode);
    }
}
