package com.lungrisk.common.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Seeded, class-stratified train/test splits and k-fold partitions.
 */
public final class StratifiedSampler {

    private StratifiedSampler() {
    }

    @Getter
    @RequiredArgsConstructor
    public static final class Split {
        private final int[] trainIndices;
        private final int[] testIndices;
    }

    /**
     * Holds out {@code testFraction} of every class (rounded) for testing.
     */
    public static Split split(int[] labels, double testFraction, long seed) {
        if (!(testFraction > 0.0 && testFraction < 1.0)) {
            throw new IllegalArgumentException("Test fraction must lie in (0, 1): " + testFraction);
        }
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        for (List<Integer> members : shuffledByClass(labels, new Random(seed)).values()) {
            int testCount = (int) Math.round(members.size() * testFraction);
            test.addAll(members.subList(0, testCount));
            train.addAll(members.subList(testCount, members.size()));
        }
        return new Split(sorted(train), sorted(test));
    }

    /**
     * Partitions row indices into {@code k} folds, dealing each class round-robin so
     * every fold keeps roughly the overall class ratio. Returns the held-out rows per fold.
     */
    public static List<int[]> folds(int[] labels, int k, long seed) {
        if (k < 2) {
            throw new IllegalArgumentException("At least two folds are required: " + k);
        }
        List<List<Integer>> folds = new ArrayList<>();
        for (int f = 0; f < k; f++) {
            folds.add(new ArrayList<>());
        }
        int next = 0;
        for (List<Integer> members : shuffledByClass(labels, new Random(seed)).values()) {
            for (int row : members) {
                folds.get(next).add(row);
                next = (next + 1) % k;
            }
        }
        List<int[]> result = new ArrayList<>(k);
        for (List<Integer> fold : folds) {
            result.add(sorted(fold));
        }
        return result;
    }

    /**
     * Rows not contained in {@code heldOut}, ascending.
     */
    public static int[] complement(int size, int[] heldOut) {
        boolean[] excluded = new boolean[size];
        for (int row : heldOut) {
            excluded[row] = true;
        }
        int[] rest = new int[size - heldOut.length];
        int i = 0;
        for (int row = 0; row < size; row++) {
            if (!excluded[row]) {
                rest[i++] = row;
            }
        }
        return rest;
    }

    private static Map<Integer, List<Integer>> shuffledByClass(int[] labels, Random random) {
        Map<Integer, List<Integer>> byClass = new TreeMap<>();
        for (int row = 0; row < labels.length; row++) {
            byClass.computeIfAbsent(labels[row], ignored -> new ArrayList<>()).add(row);
        }
        byClass.values().forEach(members -> Collections.shuffle(members, random));
        return byClass;
    }

    private static int[] sorted(List<Integer> rows) {
        return rows.stream().mapToInt(Integer::intValue).sorted().toArray();
    }
}
