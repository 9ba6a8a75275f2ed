package com.pbxguard.editor;

import java.security.SecureRandom;
import java.util.Random;
import java.util.Set;

/**
 * Produces fresh 24-character uppercase hexadecimal identifiers, drawing again
 * whenever a candidate is already taken.
 */
public class IdGenerator {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Random random;
    private int collisions;

    public IdGenerator() {
        this(new SecureRandom());
    }

    public IdGenerator(Random random) {
        this.random = random;
    }

    public String next(Set<String> taken) {
        while (true) {
            String candidate = candidate();
            if (!taken.contains(candidate)) {
                return candidate;
            }
            collisions++;
        }
    }

    /**
     * Number of candidates rejected because they were already in use.
     */
    public int getCollisions() {
        return collisions;
    }

    protected String candidate() {
        byte[] bytes = new byte[12];
        random.nextBytes(bytes);
        char[] out = new char[24];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0F];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0F];
        }
        return new String(out);
    }
}
