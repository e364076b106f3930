package com.hcltech.causal.dag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Index-level worklist traversals over an adjacency array. Every call owns its visited set,
 * so calls may run concurrently against the same (immutable) adjacency.
 */
final class Traversal {
    private Traversal() {}

    /**
     * Nodes reachable from {@code start} in one or more steps, never expanding through {@code blocked}.
     * Start nodes are only in the result if reachable from another start node.
     */
    static BitSet reach(BitSet[] adjacency, BitSet start, BitSet blocked) {
        BitSet visited = new BitSet(adjacency.length);
        Deque<Integer> work = new ArrayDeque<>();
        for (int i = start.nextSetBit(0); i >= 0; i = start.nextSetBit(i + 1)) work.push(i);
        while (!work.isEmpty()) {
            int n = work.pop();
            BitSet next = adjacency[n];
            for (int m = next.nextSetBit(0); m >= 0; m = next.nextSetBit(m + 1)) {
                if (visited.get(m) || blocked.get(m)) continue;
                visited.set(m);
                work.push(m);
            }
        }
        return visited;
    }

    static BitSet reach(BitSet[] adjacency, int start) {
        BitSet s = new BitSet(adjacency.length);
        s.set(start);
        return reach(adjacency, s, new BitSet());
    }

    /** Shortest path {@code from -> ... -> to} as indices, or empty if {@code to} is unreachable. */
    static List<Integer> path(BitSet[] adjacency, int from, int to) {
        int[] via = new int[adjacency.length];
        Arrays.fill(via, -1);
        via[from] = from;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(from);
        while (!queue.isEmpty()) {
            int n = queue.poll();
            if (n == to) break;
            BitSet next = adjacency[n];
            for (int m = next.nextSetBit(0); m >= 0; m = next.nextSetBit(m + 1)) {
                if (via[m] != -1) continue;
                via[m] = n;
                queue.add(m);
            }
        }
        if (via[to] == -1) return List.of();
        List<Integer> path = new ArrayList<>();
        for (int n = to; n != from; n = via[n]) path.add(n);
        path.add(from);
        Collections.reverse(path);
        return path;
    }
}
