package com.paramvault.api.util;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Thread-safe secure random generation for request trace identifiers.
 */
@Component
public class SecureRandomUtils {

    private static final SecureRandom RANDOM = new SecureRandom();

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /**
     * Generate a random lowercase hex string of {@code byteCount * 2} characters.
     *
     * @param byteCount number of random bytes
     * @return hex encoding of the random bytes
     */
    public String generateHex(int byteCount) {
        if (byteCount <= 0) {
            throw new IllegalArgumentException("Byte count must be positive");
        }
        byte[] bytes = new byte[byteCount];
        RANDOM.nextBytes(bytes);
        char[] out = new char[byteCount * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0f];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0f];
        }
        return new String(out);
    }

    /**
     * Generate a W3C trace-context {@code traceparent} value: version 00, a 16-byte
     * trace id, an 8-byte span id and the sampled flag.
     *
     * @return a value like {@code 00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01}
     */
    public String generateTraceparent() {
        return "00-" + generateHex(16) + "-" + generateHex(8) + "-01";
    }
}
