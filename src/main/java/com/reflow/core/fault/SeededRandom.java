package com.reflow.core.fault;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Derives a {@link Random} from the MD5 of colon-joined parts, so every draw is a pure
 * function of its inputs.
 */
public final class SeededRandom {

    private SeededRandom() {}

    public static Random of(Object... parts) {
        String payload = Arrays.stream(parts).map(String::valueOf).collect(Collectors.joining(":"));
        return new Random(seed(payload));
    }

    static long seed(String payload) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(payload.getBytes(StandardCharsets.UTF_8));
            // low 32 bits of the big-endian digest
            long value = 0;
            for (int i = digest.length - 4; i < digest.length; i++) {
                value = (value << 8) | (digest[i] & 0xFF);
            }
            return value;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 unavailable", e);
        }
    }

    /** Uniform integer in {@code [low, high]}. */
    public static int between(Random random, int low, int high) {
        return low + random.nextInt(high - low + 1);
    }
}
