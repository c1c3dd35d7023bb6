package org.learningjava.reorderfields.domain.model.plan;

import java.util.Arrays;

/**
 * Bijection over field indices. {@code get(i)} is the old index of the field that ends up at
 * position {@code i}; {@link #newPositions()} is the inverse.
 */
public final class Permutation {

    private final int[] oldIndexAt;

    private Permutation(int[] oldIndexAt) {
        boolean[] seen = new boolean[oldIndexAt.length];
        for (int idx : oldIndexAt) {
            if (idx < 0 || idx >= oldIndexAt.length || seen[idx]) {
                throw new IllegalArgumentException("Not a permutation: " + Arrays.toString(oldIndexAt));
            }
            seen[idx] = true;
        }
        this.oldIndexAt = oldIndexAt;
    }

    public static Permutation of(int... oldIndexAt) {
        return new Permutation(oldIndexAt.clone());
    }

    public static Permutation identity(int size) {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        return new Permutation(order);
    }

    public int get(int position) {
        return oldIndexAt[position];
    }

    public int size() {
        return oldIndexAt.length;
    }

    /** {@code newPositions()[oldIndex]} is the slot the field at {@code oldIndex} moves to. */
    public int[] newPositions() {
        int[] positions = new int[oldIndexAt.length];
        for (int i = 0; i < oldIndexAt.length; i++) {
            positions[oldIndexAt[i]] = i;
        }
        return positions;
    }

    public boolean isIdentity() {
        for (int i = 0; i < oldIndexAt.length; i++) {
            if (oldIndexAt[i] != i) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Permutation other)) return false;
        return Arrays.equals(oldIndexAt, other.oldIndexAt);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(oldIndexAt);
    }

    @Override
    public String toString() {
        return "Permutation" + Arrays.toString(oldIndexAt);
    }
}
