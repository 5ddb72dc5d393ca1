package com.deck.mirror.similarity;

import com.deck.mirror.core.model.CandidatePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Approximate nearest-neighbour search with an inverted-file index over
 * L2-normalized vectors (inner product equals cosine).
 *
 * <p>Vectors are clustered with a deterministic k-means into about {@code sqrt(n)}
 * lists. Each card scans only the lists of its {@code nprobe} closest centroids and
 * keeps its {@code neighborCap} best neighbours. A true duplicate that falls outside
 * those lists, or below the cap on a large and weakly clustered deck, is missed.</p>
 */
public class IvfFlatSimilarityIndex implements SimilarityIndex {
    private static final Logger log = LoggerFactory.getLogger(IvfFlatSimilarityIndex.class);

    public static final int DEFAULT_NEIGHBOR_CAP = 100;
    public static final int DEFAULT_NPROBE = 8;
    private static final int KMEANS_ITERATIONS = 10;

    private final int neighborCap;
    private final int nprobe;

    public IvfFlatSimilarityIndex() {
        this(DEFAULT_NEIGHBOR_CAP, DEFAULT_NPROBE);
    }

    public IvfFlatSimilarityIndex(int neighborCap, int nprobe) {
        if (neighborCap < 1 || nprobe < 1) {
            throw new IllegalArgumentException("neighborCap and nprobe must be positive");
        }
        this.neighborCap = neighborCap;
        this.nprobe = nprobe;
    }

    @Override
    public List<CandidatePair> findCandidatePairs(List<float[]> vectors, double threshold) {
        int n = vectors.size();
        if (n < 2) {
            return List.of();
        }
        List<float[]> normalized = new ArrayList<>(n);
        for (float[] vector : vectors) {
            normalized.add(VectorMath.normalize(vector));
        }

        int nlist = Math.max(1, (int) Math.round(Math.sqrt(n)));
        List<float[]> centroids = trainCentroids(normalized, nlist);
        List<List<Integer>> lists = assign(normalized, centroids);
        int probes = Math.min(nprobe, centroids.size());

        Map<Long, CandidatePair> unique = new HashMap<>();
        for (int i = 0; i < n; i++) {
            float[] query = normalized.get(i);
            TopK best = new TopK(neighborCap);
            for (int list : closestCentroids(query, centroids, probes)) {
                for (int j : lists.get(list)) {
                    if (j != i) {
                        best.offer(j, VectorMath.dot(query, normalized.get(j)));
                    }
                }
            }
            for (TopK.Neighbor neighbor : best.neighbors()) {
                if (neighbor.score() >= threshold) {
                    int a = Math.min(i, neighbor.index());
                    int b = Math.max(i, neighbor.index());
                    unique.putIfAbsent((long) a * n + b, new CandidatePair(a, b, neighbor.score()));
                }
            }
        }

        List<CandidatePair> pairs = new ArrayList<>(unique.values());
        Collections.sort(pairs);
        log.debug("similarity.ivf_searched cards={} lists={} nprobe={} pairs={}", n, centroids.size(), probes, pairs.size());
        return pairs;
    }

    @Override
    public String getName() {
        return "approximate";
    }

    private List<float[]> trainCentroids(List<float[]> vectors, int nlist) {
        int n = vectors.size();
        List<float[]> centroids = new ArrayList<>(nlist);
        for (int c = 0; c < nlist; c++) {
            centroids.add(vectors.get((int) ((long) c * n / nlist)).clone());
        }

        int dimension = vectors.get(0).length;
        for (int iteration = 0; iteration < KMEANS_ITERATIONS; iteration++) {
            double[][] sums = new double[nlist][dimension];
            int[] counts = new int[nlist];
            for (float[] vector : vectors) {
                int c = closestCentroids(vector, centroids, 1).get(0);
                counts[c]++;
                for (int d = 0; d < dimension; d++) {
                    sums[c][d] += vector[d];
                }
            }
            for (int c = 0; c < nlist; c++) {
                // an empty cluster keeps its previous centroid
                if (counts[c] > 0) {
                    float[] mean = new float[dimension];
                    for (int d = 0; d < dimension; d++) {
                        mean[d] = (float) (sums[c][d] / counts[c]);
                    }
                    centroids.set(c, VectorMath.normalize(mean));
                }
            }
        }
        return centroids;
    }

    private List<List<Integer>> assign(List<float[]> vectors, List<float[]> centroids) {
        List<List<Integer>> lists = new ArrayList<>(centroids.size());
        for (int c = 0; c < centroids.size(); c++) {
            lists.add(new ArrayList<>());
        }
        for (int i = 0; i < vectors.size(); i++) {
            lists.get(closestCentroids(vectors.get(i), centroids, 1).get(0)).add(i);
        }
        return lists;
    }

    private static List<Integer> closestCentroids(float[] vector, List<float[]> centroids, int count) {
        TopK best = new TopK(count);
        for (int c = 0; c < centroids.size(); c++) {
            best.offer(c, VectorMath.dot(vector, centroids.get(c)));
        }
        List<TopK.Neighbor> neighbors = best.neighbors();
        neighbors.sort((x, y) -> Double.compare(y.score(), x.score()));
        List<Integer> indices = new ArrayList<>(neighbors.size());
        for (TopK.Neighbor neighbor : neighbors) {
            indices.add(neighbor.index());
        }
        return indices;
    }
}
