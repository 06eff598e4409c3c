package org.learningjava.mediadb.domain.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Exact k-nearest-neighbour selection by L2 distance. Keeps a bounded max-heap so a scan over
 * n candidates costs O(n log k).
 */
public final class NearestNeighbours<K> {

    public record Hit<K>(K key, double distance) {
    }

    private final float[] query;
    private final int k;
    private final PriorityQueue<Hit<K>> heap;

    public NearestNeighbours(float[] query, int k) {
        if (k < 1) throw new IllegalArgumentException("limit must be >= 1, got " + k);
        this.query = query.clone();
        this.k = k;
        this.heap = new PriorityQueue<>(Comparator.comparingDouble((Hit<K> h) -> h.distance()).reversed());
    }

    public void offer(K key, float[] candidate) {
        double d = VectorMath.l2Distance(query, candidate);
        if (heap.size() < k) {
            heap.add(new Hit<>(key, d));
        } else if (d < heap.peek().distance()) {
            heap.poll();
            heap.add(new Hit<>(key, d));
        }
    }

    /** Hits ordered by ascending distance. */
    public List<Hit<K>> result() {
        List<Hit<K>> out = new ArrayList<>(heap);
        out.sort(Comparator.comparingDouble(Hit::distance));
        return Collections.unmodifiableList(out);
    }
}
