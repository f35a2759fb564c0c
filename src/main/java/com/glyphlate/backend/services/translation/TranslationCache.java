package com.glyphlate.backend.services.translation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.glyphlate.backend.config.ImageTranslationProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Size-bounded memo of translation results keyed by the call arguments.
 *
 * <p>Keys are the arguments joined with {@code '\0'}. Joined keys longer than
 * {@value #SIMPLE_KEY_THRESHOLD} characters are replaced by their SHA-1 hex digest.
 * A configured size of 0 or less disables the cache.
 */
@Component
@Slf4j
public class TranslationCache {

    static final int SIMPLE_KEY_THRESHOLD = 200;
    static final String SEPARATOR = "\0";

    private final int capacity;
    private final Cache<String, String> cache;

    @Autowired
    public TranslationCache(ImageTranslationProperties properties) {
        this(properties.getCache().getSize());
    }

    TranslationCache(int capacity) {
        this.capacity = capacity;
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, capacity))
                .executor(Runnable::run)
                .build();
        log.info("[Cache] Translation cache {}", capacity > 0 ? "size=" + capacity : "disabled");
    }

    public boolean isEnabled() {
        return capacity > 0;
    }

    public Optional<String> read(Object... args) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(cacheKey(args)));
    }

    public void write(String result, Object... args) {
        if (!isEnabled() || result == null) {
            return;
        }
        cache.put(cacheKey(args), result);
    }

    static String cacheKey(Object... args) {
        String simpleKey = Arrays.stream(args)
                .map(String::valueOf)
                .collect(Collectors.joining(SEPARATOR));

        if (simpleKey.length() <= SIMPLE_KEY_THRESHOLD) {
            return simpleKey;
        }
        return sha1Hex(simpleKey);
    }

    private static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
