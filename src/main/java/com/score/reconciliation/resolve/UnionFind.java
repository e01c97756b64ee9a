package com.score.reconciliation.resolve;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjoint-set forest over string identifiers.
 * Parent and rank tables are flat arrays indexed by the registration order
 * of each identifier; union by rank, path compression in {@link #find(int)}.
 * Not thread-safe: one instance per resolution.
 */
final class UnionFind {

    private static final int INITIAL_CAPACITY = 16;

    private final Map<String, Integer> indexById = new HashMap<>();
    private final List<String> ids = new ArrayList<>();
    private int[] parent = new int[INITIAL_CAPACITY];
    private int[] rank = new int[INITIAL_CAPACITY];

    /**
     * Registers the identifier as a singleton if unseen; returns its index.
     */
    int register(String id) {
        Integer existing = indexById.get(id);
        if (existing != null) {
            return existing;
        }
        int index = ids.size();
        if (index == parent.length) {
            int capacity = parent.length * 2;
            parent = Arrays.copyOf(parent, capacity);
            rank = Arrays.copyOf(rank, capacity);
        }
        parent[index] = index;
        rank[index] = 0;
        ids.add(id);
        indexById.put(id, index);
        return index;
    }

    int find(int index) {
        int root = index;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[index] != root) {
            int next = parent[index];
            parent[index] = root;
            index = next;
        }
        return root;
    }

    /**
     * Joins the groups of both identifiers, registering them when unseen.
     */
    void union(String a, String b) {
        int rootA = find(register(a));
        int rootB = find(register(b));
        if (rootA == rootB) {
            return;
        }
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
        } else if (rank[rootA] > rank[rootB]) {
            parent[rootB] = rootA;
        } else {
            parent[rootB] = rootA;
            rank[rootA]++;
        }
    }

    Integer indexOf(String id) {
        return indexById.get(id);
    }

    String identifier(int index) {
        return ids.get(index);
    }

    int size() {
        return ids.size();
    }
}
