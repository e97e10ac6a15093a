package io.tinylink.url.shortener.service.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Works out the public prefix of short URLs: the {@code shortener.base-url} property if set, otherwise the
 * scheme, host and non-default port of the current request.
 */
@Component
public class BaseUrlResolver {

    private final String configuredBaseUrl;

    public BaseUrlResolver(@Value("${shortener.base-url:}") String configuredBaseUrl) {
        this.configuredBaseUrl = configuredBaseUrl == null ? "" : configuredBaseUrl.trim();
    }

    public String shortUrl(HttpServletRequest request, String shortCode) {
        String baseUrl = configuredBaseUrl.isEmpty() ? fromRequest(request) : configuredBaseUrl;
        String normalized = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        return normalized + shortCode;
    }

    private static String fromRequest(HttpServletRequest request) {
        String scheme = request.getScheme();
        String host = request.getServerName();
        int port = request.getServerPort();
        boolean isDefault = (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
        return scheme + "://" + host + (isDefault ? "" : (":" + port));
    }
}
