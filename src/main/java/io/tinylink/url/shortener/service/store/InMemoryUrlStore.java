package io.tinylink.url.shortener.service.store;

import io.tinylink.url.shortener.service.exception.DuplicateShortCodeException;
import io.tinylink.url.shortener.service.exception.UrlNotFoundException;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local {@link UrlStore}. One read/write lock guards the whole table: lookups share the read lock,
 * inserts and increments are linearised under the write lock. Records are immutable values and an
 * increment swaps in a new one, so a reader only ever sees a complete record.
 */
@Component
@ConditionalOnProperty(name = "shortener.store", havingValue = "memory")
public class InMemoryUrlStore implements UrlStore {

    private final Map<String, ShortUrlRecord> records = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public ShortUrlRecord insert(ShortUrlRecord record) {
        lock.writeLock().lock();
        try {
            if (records.putIfAbsent(record.getShortCode(), record) != null) {
                throw new DuplicateShortCodeException(record.getShortCode());
            }
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public ShortUrlRecord get(String shortCode) {
        lock.readLock().lock();
        try {
            ShortUrlRecord record = records.get(shortCode);
            if (record == null) {
                throw new UrlNotFoundException(shortCode);
            }
            return record;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ShortUrlRecord incrementClick(String shortCode) {
        lock.writeLock().lock();
        try {
            ShortUrlRecord current = records.get(shortCode);
            if (current == null) {
                throw new UrlNotFoundException(shortCode);
            }
            ShortUrlRecord updated = current.withNextClick();
            records.put(shortCode, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
