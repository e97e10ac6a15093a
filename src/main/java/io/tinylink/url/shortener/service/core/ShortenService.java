package io.tinylink.url.shortener.service.core;

import io.tinylink.url.shortener.service.exception.CodeGenerationExhaustedException;
import io.tinylink.url.shortener.service.exception.DuplicateShortCodeException;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import io.tinylink.url.shortener.service.store.UrlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Creates a new mapping for every call. Submitting the same URL twice gives two codes and two records;
 * there is no lookup by original URL.
 */
@Service
public class ShortenService {

    private static final Logger log = LoggerFactory.getLogger(ShortenService.class);

    private final UrlValidator validator;
    private final ShortCodeGenerator generator;
    private final UrlStore store;
    private final Clock clock;

    public ShortenService(UrlValidator validator, ShortCodeGenerator generator, UrlStore store, Clock clock) {
        this.validator = validator;
        this.generator = generator;
        this.store = store;
        this.clock = clock;
    }

    public ShortUrlRecord shorten(String url) {
        String originalUrl = validator.validate(url);
        LocalDateTime createdAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);

        int maxAttempts = generator.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String shortCode = generator.nextCode();
            try {
                ShortUrlRecord record = store.insert(new ShortUrlRecord(shortCode, originalUrl, createdAt));
                log.info("Created short URL: {} -> {}", shortCode, originalUrl);
                return record;
            } catch (DuplicateShortCodeException ex) {
                log.debug("Short code {} collided (attempt {}/{})", shortCode, attempt, maxAttempts);
            }
        }
        log.warn("Gave up generating a short code for {} after {} attempts", originalUrl, maxAttempts);
        throw new CodeGenerationExhaustedException(maxAttempts);
    }
}
