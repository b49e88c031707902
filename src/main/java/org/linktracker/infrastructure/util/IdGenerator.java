package org.linktracker.infrastructure.util;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Opaque ids: base-36 epoch milliseconds followed by eleven base-36 random
 * characters. Sorts roughly by creation time; collisions need two ids in the
 * same millisecond with the same 55-bit suffix.
 */
public final class IdGenerator implements Supplier<String> {

    private static final int SUFFIX_LENGTH = 11;

    @Override
    public String get() {
        StringBuilder sb = new StringBuilder(Long.toString(System.currentTimeMillis(), 36));
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(Character.forDigit(rnd.nextInt(36), 36));
        }
        return sb.toString();
    }
}
