package com.example.shorturl.service;

import com.example.shorturl.exception.ServiceException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.ProviderException;
import java.security.SecureRandom;

@Component
public class ShortCodeGenerator {

    static final String BASE62 = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final SecureRandom random;

    @Autowired
    public ShortCodeGenerator() {
        this(new SecureRandom());
    }

    ShortCodeGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        StringBuilder sb = new StringBuilder(length);
        try {
            for (int i = 0; i < length; i++) {
                sb.append(BASE62.charAt(random.nextInt(BASE62.length())));
            }
        } catch (ProviderException e) {
            throw ServiceException.internal("generator.generate", "random source unavailable", e);
        }
        return sb.toString();
    }
}
