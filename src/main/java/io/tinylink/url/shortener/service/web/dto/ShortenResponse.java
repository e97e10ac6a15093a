package io.tinylink.url.shortener.service.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;

public record ShortenResponse(
        @JsonProperty("short_code") String shortCode,
        @JsonProperty("original_url") String originalUrl,
        @JsonProperty("short_url") String shortUrl) {

    public static ShortenResponse of(ShortUrlRecord record, String shortUrl) {
        return new ShortenResponse(record.getShortCode(), record.getOriginalUrl(), shortUrl);
    }
}
