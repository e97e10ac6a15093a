package io.tinylink.url.shortener.service.store;

import io.tinylink.url.shortener.service.exception.DuplicateShortCodeException;
import io.tinylink.url.shortener.service.exception.UrlNotFoundException;
import io.tinylink.url.shortener.service.exception.UrlStoreException;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import io.tinylink.url.shortener.service.repository.ShortUrlRecordRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Relational {@link UrlStore} on the {@code short_urls} table.
 * <p>
 * Inserts and increments run one at a time: a process-wide lock is held from before the transaction begins
 * until after it commits. Reads take no lock and see committed rows only. Within the database the primary key
 * on {@code short_code} still rejects a code written by another process, and the click counter is bumped by a
 * single {@code UPDATE}, never read back and rewritten. An integrity violation on insert counts as a duplicate
 * only when the code is already stored; any other violation is a store failure.
 */
@Component
@ConditionalOnProperty(name = "shortener.store", havingValue = "jpa", matchIfMissing = true)
public class JpaUrlStore implements UrlStore {

    private final ShortUrlRecordRepository repository;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;
    private final Lock writeLock = new ReentrantLock();

    public JpaUrlStore(ShortUrlRecordRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    public ShortUrlRecord insert(ShortUrlRecord record) {
        writeLock.lock();
        try {
            writeTransaction.executeWithoutResult(status ->
                    repository.insert(record.getShortCode(), record.getOriginalUrl(), record.getCreatedAt()));
            return record;
        } catch (DataIntegrityViolationException ex) {
            if (codeExists(record.getShortCode())) {
                throw new DuplicateShortCodeException(record.getShortCode());
            }
            throw new UrlStoreException("Failed to insert short code " + record.getShortCode(), ex);
        } catch (DataAccessException | TransactionException ex) {
            throw new UrlStoreException("Failed to insert short code " + record.getShortCode(), ex);
        } finally {
            writeLock.unlock();
        }
    }

    // Called with the write lock held, so no insert of ours can land between the failure and this check.
    private boolean codeExists(String shortCode) {
        try {
            return Boolean.TRUE.equals(readTransaction.execute(status -> repository.existsById(shortCode)));
        } catch (DataAccessException | TransactionException ex) {
            throw new UrlStoreException("Failed to check short code " + shortCode, ex);
        }
    }

    @Override
    public ShortUrlRecord get(String shortCode) {
        Optional<ShortUrlRecord> record;
        try {
            record = readTransaction.execute(status -> repository.findById(shortCode));
        } catch (DataAccessException | TransactionException ex) {
            throw new UrlStoreException("Failed to read short code " + shortCode, ex);
        }
        return record.orElseThrow(() -> new UrlNotFoundException(shortCode));
    }

    @Override
    public ShortUrlRecord incrementClick(String shortCode) {
        writeLock.lock();
        try {
            return writeTransaction.execute(status -> {
                if (repository.incrementClickCount(shortCode) == 0) {
                    throw new UrlNotFoundException(shortCode);
                }
                return repository.findById(shortCode)
                        .orElseThrow(() -> new UrlNotFoundException(shortCode));
            });
        } catch (DataAccessException | TransactionException ex) {
            throw new UrlStoreException("Failed to count click for short code " + shortCode, ex);
        } finally {
            writeLock.unlock();
        }
    }
}
