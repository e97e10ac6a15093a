package io.tinylink.url.shortener.service.store;

import io.tinylink.url.shortener.service.exception.DuplicateShortCodeException;
import io.tinylink.url.shortener.service.exception.UrlNotFoundException;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;

/**
 * Durable mapping from short code to {@link ShortUrlRecord}.
 * <p>
 * Every operation is atomic with respect to concurrent callers. Implementations own all locking or
 * transaction discipline; callers never coordinate among themselves.
 */
public interface UrlStore {

    /**
     * Creates the record. The existence check and the write are a single step, so of two callers racing
     * on the same code exactly one succeeds.
     *
     * @throws DuplicateShortCodeException if the code is already taken; nothing is written
     */
    ShortUrlRecord insert(ShortUrlRecord record);

    /**
     * @throws UrlNotFoundException if no record has this code
     */
    ShortUrlRecord get(String shortCode);

    /**
     * Adds one to the click count and returns the record as it is after the increment.
     *
     * @throws UrlNotFoundException if no record has this code; nothing is written
     */
    ShortUrlRecord incrementClick(String shortCode);
}
