package io.tinylink.url.shortener.service.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "short_urls")
public class ShortUrlRecord {

    @Id
    @Column(name = "short_code", nullable = false, length = 6)
    private String shortCode;

    @Column(name = "original_url", nullable = false, length = 2048)
    private String originalUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "click_count", nullable = false)
    private long clickCount;

    protected ShortUrlRecord() {
        // JPA only
    }

    public ShortUrlRecord(String shortCode, String originalUrl, LocalDateTime createdAt) {
        this(shortCode, originalUrl, createdAt, 0L);
    }

    public ShortUrlRecord(String shortCode, String originalUrl, LocalDateTime createdAt, long clickCount) {
        this.shortCode = shortCode;
        this.originalUrl = originalUrl;
        this.createdAt = createdAt;
        this.clickCount = clickCount;
    }

    /**
     * Copy of this record with one more click. Code, URL and creation time are carried over unchanged.
     */
    public ShortUrlRecord withNextClick() {
        return new ShortUrlRecord(shortCode, originalUrl, createdAt, clickCount + 1);
    }

    public String getShortCode() {
        return shortCode;
    }

    public String getOriginalUrl() {
        return originalUrl;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public long getClickCount() {
        return clickCount;
    }

    @Override
    public String toString() {
        return "ShortUrlRecord{shortCode='" + shortCode + "', originalUrl='" + originalUrl
                + "', createdAt=" + createdAt + ", clickCount=" + clickCount + '}';
    }
}
