package io.tinylink.url.shortener.service.repository;

import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;

/**
 * Only {@link io.tinylink.url.shortener.service.store.JpaUrlStore} talks to this repository.
 * New rows go through {@link #insert}, never {@code save}: with an assigned id {@code save} merges and
 * would overwrite an existing code instead of failing on it.
 */
public interface ShortUrlRecordRepository extends JpaRepository<ShortUrlRecord, String> {

    @Modifying
    @Query(value = "insert into short_urls (short_code, original_url, created_at, click_count) "
            + "values (:shortCode, :originalUrl, :createdAt, 0)", nativeQuery = true)
    int insert(@Param("shortCode") String shortCode,
               @Param("originalUrl") String originalUrl,
               @Param("createdAt") LocalDateTime createdAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ShortUrlRecord r set r.clickCount = r.clickCount + 1 where r.shortCode = :shortCode")
    int incrementClickCount(@Param("shortCode") String shortCode);
}
