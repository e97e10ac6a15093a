package io.tinylink.url.shortener.service.exception;

public class UrlStoreException extends RuntimeException {

    public UrlStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
