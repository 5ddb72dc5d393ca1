package com.deck.mirror.similarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the k highest-scoring neighbours seen so far.
 */
final class TopK {

    private final int k;
    private final PriorityQueue<Neighbor> heap = new PriorityQueue<>(Comparator.comparingDouble(Neighbor::score));

    TopK(int k) {
        this.k = k;
    }

    void offer(int index, double score) {
        if (heap.size() < k) {
            heap.add(new Neighbor(index, score));
        } else if (score > heap.peek().score()) {
            heap.poll();
            heap.add(new Neighbor(index, score));
        }
    }

    List<Neighbor> neighbors() {
        return new ArrayList<>(heap);
    }

    record Neighbor(int index, double score) {}
}
