package io.tinylink.url.shortener.service.exception;

/**
 * A proposed short code is already stored. Raised by the store and consumed by the shorten retry loop;
 * it is not expected to reach a controller.
 */
public class DuplicateShortCodeException extends RuntimeException {

    private final String shortCode;

    public DuplicateShortCodeException(String shortCode) {
        super("Short code already in use: " + shortCode);
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
