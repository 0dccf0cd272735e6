package com.example.shorturl.repository;

import com.example.shorturl.config.ShortenerProperties;
import com.example.shorturl.exception.ServiceException;
import com.example.shorturl.model.ShortUrl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;

/**
 * {@link ShortUrlStore} over Spring Data JPA. Each call runs in its own transaction bounded by
 * {@code app.shortener.request-timeout}.
 */
@Slf4j
@Component
public class JpaShortUrlStore implements ShortUrlStore {

    private final ShortUrlRepository repository;
    private final TransactionTemplate tx;

    public JpaShortUrlStore(ShortUrlRepository repository,
                            PlatformTransactionManager transactionManager,
                            ShortenerProperties properties) {
        this.repository = repository;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setTimeout((int) Math.max(1, properties.getRequestTimeout().toSeconds()));
    }

    @Override
    public ShortUrl create(ShortUrl shortUrl) {
        log.debug("Creating short URL {} -> {}", shortUrl.getShortCode(), shortUrl.getUrl());
        ShortUrl saved;
        try {
            saved = tx.execute(status -> repository.saveAndFlush(shortUrl));
        } catch (DataIntegrityViolationException e) {
            log.warn("Short code {} rejected by unique constraint", shortUrl.getShortCode());
            throw ServiceException.duplicate("repository.create", "short code already exists");
        } catch (DataAccessException | TransactionException e) {
            throw translate("repository.create", "failed to create record", e);
        }
        log.info("Short URL record created: code={} id={}", saved.getShortCode(), saved.getId());
        return saved;
    }

    @Override
    public ShortUrl getByCode(String shortCode) {
        log.debug("Looking up short URL by code {}", shortCode);
        return execute("repository.getByCode", "failed to lookup record",
                status -> findOrThrow("repository.getByCode", shortCode));
    }

    @Override
    public boolean existsByCode(String shortCode) {
        log.debug("Checking if short code {} exists", shortCode);
        return execute("repository.existsByCode", "failed to check record",
                status -> repository.existsByShortCode(shortCode));
    }

    @Override
    public ShortUrl update(String shortCode, String newUrl) {
        log.debug("Updating short URL {} -> {}", shortCode, newUrl);
        return execute("repository.update", "failed to update record", status -> {
            ShortUrl shortUrl = findOrThrow("repository.update", shortCode);
            shortUrl.setUrl(newUrl);
            return repository.saveAndFlush(shortUrl);
        });
    }

    @Override
    public void delete(String shortCode) {
        log.debug("Deleting short URL {}", shortCode);
        execute("repository.delete", "failed to delete record", status -> {
            repository.delete(findOrThrow("repository.delete", shortCode));
            return null;
        });
    }

    @Override
    public void incrementAccessCount(String shortCode) {
        int updated = execute("repository.incrementAccessCount", "failed to update record",
                status -> repository.incrementAccessCount(shortCode, Instant.now()));
        if (updated == 0) {
            throw ServiceException.notFound("repository.incrementAccessCount", "record not found");
        }
    }

    @Override
    public long count() {
        return execute("repository.count", "failed to count records", status -> repository.count());
    }

    private ShortUrl findOrThrow(String op, String shortCode) {
        return repository.findByShortCode(shortCode)
                .orElseThrow(() -> ServiceException.notFound(op, "short URL not found"));
    }

    private <T> T execute(String op, String failure, TransactionCallback<T> action) {
        try {
            return tx.execute(action);
        } catch (DataAccessException | TransactionException e) {
            throw translate(op, failure, e);
        }
    }

    private ServiceException translate(String op, String failure, RuntimeException e) {
        if (e instanceof TransactionTimedOutException || e instanceof QueryTimeoutException) {
            log.error("{} timed out", op, e);
            return ServiceException.internal(op, "persistence call timed out", e);
        }
        log.error("{} failed", op, e);
        return ServiceException.internal(op, failure, e);
    }
}
