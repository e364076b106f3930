package com.hcltech.causal.docalculus;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.Reachability;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily enumerated candidate sets, smallest first. Within one size, sets follow the pool's order
 * lexicographically, so the first valid set found is a minimum-size one.
 */
public final class CandidateSets {
    private CandidateSets() {}

    /**
     * Backdoor candidates: subsets of the non-descendants of {@code x}, excluding {@code x}, {@code y}
     * and {@code unobserved}. Includes the empty set.
     */
    public static Stream<Set<String>> backdoor(CausalGraph g, String x, String y, Set<String> unobserved, int maxSize) {
        Set<String> excluded = new HashSet<>(Reachability.descendants(g, x));
        excluded.add(x);
        excluded.add(y);
        excluded.addAll(unobserved);
        List<String> pool = new ArrayList<>();
        for (String v : g.variables()) if (!excluded.contains(v)) pool.add(v);
        return subsets(pool, 0, maxSize);
    }

    /**
     * Frontdoor candidates: non-empty subsets of the variables lying on directed paths from {@code x}
     * to {@code y}, excluding {@code y} and {@code unobserved}.
     */
    public static Stream<Set<String>> frontdoor(CausalGraph g, String x, String y, Set<String> unobserved, int maxSize) {
        Set<String> between = new LinkedHashSet<>(Reachability.descendants(g, x));
        between.retainAll(Reachability.ancestors(g, y));
        between.remove(y);
        between.removeAll(unobserved);
        List<String> pool = new ArrayList<>();
        for (String v : g.variables()) if (between.contains(v)) pool.add(v);
        return subsets(pool, 1, maxSize);
    }

    /** Every subset of {@code pool} with size in {@code [minSize, maxSize]}, by increasing size. */
    public static Stream<Set<String>> subsets(List<String> pool, int minSize, int maxSize) {
        int upper = Math.min(maxSize, pool.size());
        Iterator<Set<String>> it = new Combinations(List.copyOf(pool), minSize, upper);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** k-combinations of index positions for k = min..max, advancing in place. */
    private static final class Combinations implements Iterator<Set<String>> {
        private final List<String> pool;
        private final int max;
        private int k;
        private int[] idx;

        Combinations(List<String> pool, int min, int max) {
            this.pool = pool;
            this.max = max;
            this.k = min;
            this.idx = k <= max ? first(k) : null;
        }

        private static int[] first(int k) {
            int[] a = new int[k];
            for (int i = 0; i < k; i++) a[i] = i;
            return a;
        }

        @Override
        public boolean hasNext() {
            return idx != null;
        }

        @Override
        public Set<String> next() {
            if (idx == null) throw new NoSuchElementException();
            Set<String> out = new LinkedHashSet<>();
            for (int i : idx) out.add(pool.get(i));
            advance();
            return out;
        }

        private void advance() {
            int n = pool.size();
            int i = k - 1;
            while (i >= 0 && idx[i] == n - k + i) i--;
            if (i >= 0) {
                idx[i]++;
                for (int j = i + 1; j < k; j++) idx[j] = idx[j - 1] + 1;
                return;
            }
            k++;
            idx = k <= max ? first(k) : null;
        }
    }
}
