package com.residencyinsight.core.model;

import java.util.Objects;

/**
 * Aroon-Up / Aroon-Down sequences aligned with a series.
 *
 * <p>
 * Values lie in {@code [0, 100]} from index {@code window - 1} onward and are
 * {@code NaN} before it.
 * </p>
 *
 * @since 1.0.0
 */
public final class AroonPair {

    private final int window;
    private final double[] up;
    private final double[] down;

    public AroonPair(int window, double[] up, double[] down) {
        Objects.requireNonNull(up, "up must not be null");
        Objects.requireNonNull(down, "down must not be null");
        if (up.length != down.length) {
            throw new IllegalArgumentException("up and down differ in length: "
                    + up.length + " vs " + down.length);
        }
        this.window = window;
        this.up = up.clone();
        this.down = down.clone();
    }

    public int getWindow() {
        return window;
    }

    public int length() {
        return up.length;
    }

    /**
     * @param index series index
     * @return {@code true} if both values are defined at {@code index}
     */
    public boolean isDefined(int index) {
        return !Double.isNaN(up[index]) && !Double.isNaN(down[index]);
    }

    public double upAt(int index) {
        return up[index];
    }

    public double downAt(int index) {
        return down[index];
    }

    public double[] getUp() {
        return up.clone();
    }

    public double[] getDown() {
        return down.clone();
    }

    @Override
    public String toString() {
        return "AroonPair{window=" + window + ", length=" + up.length + '}';
    }
}
