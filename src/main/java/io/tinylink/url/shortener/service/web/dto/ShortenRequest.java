package io.tinylink.url.shortener.service.web.dto;

import jakarta.validation.constraints.NotBlank;

public record ShortenRequest(
        @NotBlank(message = "Missing 'url' field in request body") String url) {
}
