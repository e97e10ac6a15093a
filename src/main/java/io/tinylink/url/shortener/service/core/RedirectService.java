package io.tinylink.url.shortener.service.core;

import io.tinylink.url.shortener.service.exception.UrlNotFoundException;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import io.tinylink.url.shortener.service.store.UrlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RedirectService {

    private static final Logger log = LoggerFactory.getLogger(RedirectService.class);

    private final UrlStore store;

    public RedirectService(UrlStore store) {
        this.store = store;
    }

    /**
     * Resolves the code and counts the visit. The click is recorded before the target is returned.
     *
     * @throws UrlNotFoundException for malformed or unknown codes
     */
    public String resolve(String shortCode) {
        if (!ShortCodeGenerator.isWellFormed(shortCode)) {
            throw new UrlNotFoundException(shortCode);
        }
        ShortUrlRecord record = store.get(shortCode);
        ShortUrlRecord counted = store.incrementClick(record.getShortCode());
        log.debug("Redirect: {} -> {} (clicks={})", shortCode, counted.getOriginalUrl(), counted.getClickCount());
        return counted.getOriginalUrl();
    }
}
