package com.attendauth.sdk.storage;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 얼굴 임베딩 (기본 128차원). 생성 후 불변.
 * 원값은 toString()에 노출하지 않는다.
 */
public final class Embedding {

    private final double[] values;

    private Embedding(double[] values) {
        this.values = values;
    }

    public static Embedding of(double... values) {
        checkNotNull(values, "values");
        return new Embedding(values.clone());
    }

    public static Embedding of(float[] values) {
        checkNotNull(values, "values");
        double[] copy = new double[values.length];
        for (int i = 0; i < values.length; i++) copy[i] = values[i];
        return new Embedding(copy);
    }

    public int dimension() { return values.length; }

    public double get(int i) { return values[i]; }

    public double[] toArray() { return values.clone(); }

    /** 유클리드 거리. 차원이 다르면 IllegalArgumentException (호출 전 검증 책임은 호출자). */
    public double distanceTo(Embedding other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("차원 불일치: " + values.length + " vs " + other.values.length);
        }
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            double d = values[i] - other.values[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    @Override public boolean equals(Object o) {
        return o instanceof Embedding && Arrays.equals(values, ((Embedding) o).values);
    }

    @Override public int hashCode() { return Arrays.hashCode(values); }

    @Override public String toString() {
        return "Embedding{dim=" + values.length + "}";
    }
}
