package io.tinylink.url.shortener.service.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;

import java.time.LocalDateTime;

public record UrlStatsResponse(
        @JsonProperty("short_code") String shortCode,
        @JsonProperty("original_url") String originalUrl,
        @JsonProperty("click_count") long clickCount,
        @JsonProperty("created_at") LocalDateTime createdAt) {

    public static UrlStatsResponse of(ShortUrlRecord record) {
        return new UrlStatsResponse(record.getShortCode(), record.getOriginalUrl(),
                record.getClickCount(), record.getCreatedAt());
    }
}
