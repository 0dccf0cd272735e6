package com.example.shorturl.service;

import com.example.shorturl.exception.ErrorKind;
import com.example.shorturl.exception.ServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ShortCodeGeneratorTest {

    private final ShortCodeGenerator generator = new ShortCodeGenerator();

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 4, 6, 20, 64})
    @DisplayName("generated code has the requested length and only base62 characters")
    void generatesExactLengthBase62(int length) {
        String code = generator.generate(length);

        assertEquals(length, code.length());
        assertTrue(code.matches("[0-9a-zA-Z]*"), () -> "unexpected characters in " + code);
    }

    @Test
    void zeroLengthIsEmpty() {
        assertEquals("", generator.generate(0));
    }

    @Test
    @DisplayName("1000 six-character codes do not collide")
    void codesDoNotCollide() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            assertTrue(seen.add(generator.generate(6)));
        }
    }

    @Test
    void usesWholeAlphabet() {
        Set<Character> seen = new HashSet<>();
        String code = generator.generate(20_000);
        for (char c : code.toCharArray()) {
            seen.add(c);
        }
        assertEquals(ShortCodeGenerator.BASE62.length(), seen.size());
    }

    @Test
    void negativeLengthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> generator.generate(-1));
    }

    @Test
    @DisplayName("failing random source surfaces as an internal error")
    void randomSourceFailure() {
        SecureRandom broken = new SecureRandom() {
            @Override
            public int nextInt(int bound) {
                throw new ProviderException("entropy source unavailable");
            }
        };
        ShortCodeGenerator failing = new ShortCodeGenerator(broken);

        ServiceException ex = assertThrows(ServiceException.class, () -> failing.generate(6));

        assertEquals(ErrorKind.INTERNAL, ex.getKind());
        assertInstanceOf(ProviderException.class, ex.getCause());
        assertEquals("", failing.generate(0));
    }
}
