package com.gillianbc.retirement.numeric;

import java.util.Objects;
import java.util.Random;

/**
 * Standard normal draws from a seedable uniform source using the Box-Muller transform.
 */
public class GaussianSampler {

    private final Random random;

    public GaussianSampler(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public GaussianSampler(long seed) {
        this(new Random(seed));
    }

    /**
     * Returns the next N(0, 1) sample. Uniform draws of exactly zero are redrawn since
     * {@code log(0)} is undefined.
     */
    public double next() {
        double u1 = nonZeroUniform();
        double u2 = nonZeroUniform();
        return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
    }

    private double nonZeroUniform() {
        double u;
        do {
            u = random.nextDouble();
        } while (u == 0.0);
        return u;
    }
}
