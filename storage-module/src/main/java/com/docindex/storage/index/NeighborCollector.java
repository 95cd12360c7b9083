package com.docindex.storage.index;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the k best neighbors seen so far in a bounded max-heap.
 */
final class NeighborCollector {

    private final int k;
    private final PriorityQueue<Neighbor> heap;

    NeighborCollector(int k) {
        this.k = k;
        this.heap = new PriorityQueue<>(Math.max(1, k + 1), Neighbor.BY_DISTANCE.reversed());
    }

    void offer(long id, double distance) {
        if (k <= 0) {
            return;
        }
        Neighbor candidate = new Neighbor(id, distance);
        if (heap.size() < k) {
            heap.add(candidate);
        } else if (Neighbor.BY_DISTANCE.compare(candidate, heap.peek()) < 0) {
            heap.poll();
            heap.add(candidate);
        }
    }

    List<Neighbor> sorted() {
        List<Neighbor> result = new ArrayList<>(heap);
        result.sort(Neighbor.BY_DISTANCE);
        return result;
    }
}
