package com.example.shorturl.service;

import com.example.shorturl.config.ShortenerProperties;
import com.example.shorturl.exception.ServiceException;
import com.example.shorturl.exception.ValidationFailure;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Blocked domains are matched by exact equality against the lower-cased host, so an entry
 * {@code malware.com} does not block {@code sub.malware.com}.
 */
@Component
public class UrlValidator {

    static final int MIN_CODE_LENGTH = 4;
    static final int MAX_CODE_LENGTH = 20;

    private final int maxUrlLength;
    private final Set<String> blockedDomains;

    public UrlValidator(ShortenerProperties properties) {
        this.maxUrlLength = properties.getMaxUrlLength();
        this.blockedDomains = properties.getBlockedDomains().stream()
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public void validateUrl(String rawUrl) {
        if (rawUrl == null) {
            throw ServiceException.validation("validator.validateUrl", ValidationFailure.INVALID_URL_FORMAT);
        }
        if (rawUrl.length() > maxUrlLength) {
            throw ServiceException.validation("validator.validateUrl", ValidationFailure.URL_TOO_LONG);
        }

        // java.net.URL lower-cases the protocol, so the scheme is taken from the raw string
        String scheme = schemeOf(rawUrl);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw ServiceException.validation("validator.validateUrl", ValidationFailure.UNSUPPORTED_SCHEME);
        }

        URL url;
        try {
            url = new URL(rawUrl);
        } catch (MalformedURLException e) {
            throw ServiceException.validation("validator.validateUrl", ValidationFailure.INVALID_URL_FORMAT, e);
        }

        if (isDomainBlocked(url.getHost())) {
            throw ServiceException.validation("validator.validateUrl", ValidationFailure.DOMAIN_BLOCKED);
        }
    }

    public void validateShortCode(String code) {
        if (code == null || code.length() < MIN_CODE_LENGTH || code.length() > MAX_CODE_LENGTH) {
            throw ServiceException.validation("validator.validateShortCode", ValidationFailure.CODE_LENGTH_OUT_OF_RANGE);
        }
        for (int i = 0; i < code.length(); i++) {
            if (!isAlphaNumeric(code.charAt(i))) {
                throw ServiceException.validation("validator.validateShortCode", ValidationFailure.CODE_NOT_ALPHANUMERIC);
            }
        }
    }

    private static String schemeOf(String rawUrl) {
        int colon = rawUrl.indexOf(':');
        return colon > 0 ? rawUrl.substring(0, colon) : null;
    }

    private boolean isDomainBlocked(String host) {
        return blockedDomains.contains(host.toLowerCase(Locale.ROOT));
    }

    private static boolean isAlphaNumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
