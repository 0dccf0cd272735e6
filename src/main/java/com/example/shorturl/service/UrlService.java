package com.example.shorturl.service;

import com.example.shorturl.dto.CreateUrlRequest;
import com.example.shorturl.dto.ShortenResponse;
import com.example.shorturl.dto.UpdateUrlRequest;
import com.example.shorturl.dto.UrlInfoResponse;
import com.example.shorturl.exception.ServiceException;
import com.example.shorturl.model.ShortUrl;
import com.example.shorturl.repository.ShortUrlStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class UrlService {

    private final UrlValidator validator;
    private final ShortCodeResolver resolver;
    private final ShortUrlStore store;

    @Value("${app.base-url}")
    private String baseUrl;

    public ShortenResponse createShortUrl(CreateUrlRequest request) {
        validator.validateUrl(request.getUrl());

        String shortCode = resolver.resolveCode(request.getCustomCode());

        ShortUrl created = store.create(new ShortUrl(request.getUrl(), shortCode));
        log.info("Short URL created: code={} url={}", created.getShortCode(), created.getUrl());

        return new ShortenResponse(
                created.getId(),
                created.getUrl(),
                created.getShortCode(),
                buildShortUrl(created.getShortCode()),
                created.getCreatedAt(),
                created.getUpdatedAt());
    }

    /**
     * Looks up the record and counts the access. The returned snapshot is the one read before the increment.
     */
    public UrlInfoResponse getOriginalUrl(String shortCode) {
        return toInfoResponse(resolveAndCount(shortCode));
    }

    public String resolveRedirect(String shortCode) {
        return resolveAndCount(shortCode).getUrl();
    }

    public UrlInfoResponse updateShortUrl(String shortCode, UpdateUrlRequest request) {
        validator.validateUrl(request.getUrl());

        ShortUrl updated = store.update(shortCode, request.getUrl());
        log.info("Short URL updated: code={} url={}", shortCode, request.getUrl());
        return toInfoResponse(updated);
    }

    public void deleteShortUrl(String shortCode) {
        store.delete(shortCode);
        log.info("Short URL deleted: code={}", shortCode);
    }

    public UrlInfoResponse getStatistics(String shortCode) {
        return toInfoResponse(store.getByCode(shortCode));
    }

    private ShortUrl resolveAndCount(String shortCode) {
        ShortUrl shortUrl = store.getByCode(shortCode);
        try {
            store.incrementAccessCount(shortCode);
        } catch (ServiceException e) {
            throw ServiceException.internal("service.getOriginalUrl", "failed to increment access count", e);
        }
        return shortUrl;
    }

    private UrlInfoResponse toInfoResponse(ShortUrl shortUrl) {
        return new UrlInfoResponse(
                shortUrl.getId(),
                shortUrl.getUrl(),
                shortUrl.getShortCode(),
                buildShortUrl(shortUrl.getShortCode()),
                shortUrl.getAccessCount(),
                shortUrl.getCreatedAt(),
                shortUrl.getUpdatedAt());
    }

    private String buildShortUrl(String shortCode) {
        String normalized = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        return normalized + shortCode;
    }
}
