package com.sensortwin.core.sensor;

import java.nio.charset.StandardCharsets;

/**
 * Derives reproducible, well-separated random seeds for sensors and samples.
 *
 * <p>
 * Every sample gets its own generator seeded from the sensor seed and the step
 * index, so results do not depend on how samples are scheduled across threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeedSequence {

    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;
    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private SeedSequence() {
        // static helpers only
    }

    /**
     * Stable seed of a sensor id (FNV-1a over its UTF-8 bytes, then mixed).
     */
    public static long fromId(String sensorId) {
        long hash = FNV_OFFSET;
        for (byte b : sensorId.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        return mix(hash);
    }

    /**
     * Seed of the random generator for sample {@code step} of a sensor.
     */
    public static long forSample(long sensorSeed, long step) {
        return mix(sensorSeed + GOLDEN_GAMMA * (step + 1));
    }

    /** SplitMix64 finalizer. */
    static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
