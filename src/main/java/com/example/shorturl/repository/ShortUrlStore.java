package com.example.shorturl.repository;

import com.example.shorturl.model.ShortUrl;

/**
 * Record store used by the service layer. Every method fails with a
 * {@link com.example.shorturl.exception.ServiceException}; {@code create} reports a unique-key
 * conflict as {@code DUPLICATE} so a lost check-then-create race is distinguishable from other failures.
 */
public interface ShortUrlStore {

    ShortUrl create(ShortUrl shortUrl);

    ShortUrl getByCode(String shortCode);

    boolean existsByCode(String shortCode);

    ShortUrl update(String shortCode, String newUrl);

    void delete(String shortCode);

    void incrementAccessCount(String shortCode);

    long count();
}
