package com.example.shorturl.service;

import com.example.shorturl.config.ShortenerProperties;
import com.example.shorturl.exception.ErrorKind;
import com.example.shorturl.exception.ServiceException;
import com.example.shorturl.repository.ShortUrlStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The existence check is a pre-check only. Two concurrent requests can still settle on the same code,
 * and the store's unique constraint then rejects the second create as a duplicate.
 */
@Slf4j
@Component
public class ShortCodeResolver {

    private final ShortCodeGenerator generator;
    private final UrlValidator validator;
    private final ShortUrlStore store;
    private final int codeLength;
    private final int maxRetries;

    public ShortCodeResolver(ShortCodeGenerator generator,
                             UrlValidator validator,
                             ShortUrlStore store,
                             ShortenerProperties properties) {
        this.generator = generator;
        this.validator = validator;
        this.store = store;
        this.codeLength = properties.getCodeLength();
        this.maxRetries = properties.getMaxRetries();
    }

    public String resolveCode(String customCode) {
        if (customCode != null) {
            return resolveCustomCode(customCode);
        }
        return generateUniqueCode();
    }

    private String resolveCustomCode(String customCode) {
        validator.validateShortCode(customCode);

        if (exists("resolver.resolveCustomCode", customCode)) {
            throw ServiceException.duplicate("resolver.resolveCustomCode", "short code already exists");
        }
        return customCode;
    }

    private String generateUniqueCode() {
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            String code = generator.generate(codeLength);
            if (!exists("resolver.generateUniqueCode", code)) {
                return code;
            }
            log.debug("Generated code {} already taken (attempt {}/{})", code, attempt, maxRetries);
        }
        log.warn("No free short code after {} attempts", maxRetries);
        throw ServiceException.internal("resolver.generateUniqueCode",
                "failed to generate unique code after " + maxRetries + " attempts", null);
    }

    private boolean exists(String op, String code) {
        try {
            return store.existsByCode(code);
        } catch (ServiceException e) {
            if (e.getKind() == ErrorKind.NOT_FOUND) {
                return false;
            }
            throw ServiceException.internal(op, "failed to check code existence", e);
        }
    }
}
