package com.sentinel.enrich;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-1 over the normalized line, as 40 lowercase hex characters. Unseeded, so
 * stable across runs.
 */
@Component
@RequiredArgsConstructor
public class Fingerprinter {
    private final LineNormalizer normalizer;

    public String fingerprint(String raw) {
        byte[] digest = sha1().digest(normalizer.normalize(raw).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
