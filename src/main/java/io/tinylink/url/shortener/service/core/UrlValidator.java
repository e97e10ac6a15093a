package io.tinylink.url.shortener.service.core;

import io.tinylink.url.shortener.service.exception.InvalidUrlException;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Accepts absolute http/https URLs with a host and returns them in normalized form: trimmed, scheme and host
 * lower-cased, everything after the host (port, path, query, fragment) kept exactly as given.
 */
@Component
public class UrlValidator {

    static final int MAX_URL_LENGTH = 2048;

    public String validate(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidUrlException("URL cannot be empty");
        }
        String trimmed = url.trim();
        if (trimmed.length() > MAX_URL_LENGTH) {
            throw new InvalidUrlException("URL is longer than " + MAX_URL_LENGTH + " characters");
        }
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException ex) {
            throw new InvalidUrlException("Invalid URL format");
        }
        if (uri.getScheme() == null) {
            throw new InvalidUrlException("Invalid URL format");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidUrlException("Only HTTP/HTTPS URLs are allowed");
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new InvalidUrlException("Invalid URL format");
        }
        return normalize(trimmed, uri, scheme);
    }

    private static String normalize(String trimmed, URI uri, String scheme) {
        StringBuilder authority = new StringBuilder();
        if (uri.getRawUserInfo() != null) {
            authority.append(uri.getRawUserInfo()).append('@');
        }
        authority.append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            authority.append(':').append(uri.getPort());
        }
        // scheme + "://" + raw authority is a verbatim prefix of the input when a host was parsed
        int tailStart = uri.getScheme().length() + 3 + uri.getRawAuthority().length();
        return scheme + "://" + authority + trimmed.substring(tailStart);
    }
}
