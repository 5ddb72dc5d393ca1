package com.deck.mirror.curation;

import com.deck.mirror.cache.ContentCache;
import com.deck.mirror.metrics.MetricsService;
import com.deck.mirror.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Runs network-bound requests in fixed-size windows.
 *
 * <p>All requests of a window are issued concurrently and the whole window is awaited
 * before the next one starts, so at most {@code windowSize} requests are ever in
 * flight. Only the calling thread reads or writes caches and result maps; worker
 * threads run nothing but the request itself.</p>
 */
public class WindowedBatchExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WindowedBatchExecutor.class);

    public static final int DEFAULT_WINDOW_SIZE = 10;

    private final int windowSize;
    private final ExecutorService executor;
    private final MetricsService metricsService;

    public WindowedBatchExecutor() {
        this(DEFAULT_WINDOW_SIZE, new NoOpMetricsService());
    }

    public WindowedBatchExecutor(int windowSize, MetricsService metricsService) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0");
        }
        this.windowSize = windowSize;
        this.executor = Executors.newFixedThreadPool(windowSize, runnable -> {
            Thread thread = new Thread(runnable, "deck-mirror-window");
            thread.setDaemon(true);
            return thread;
        });
        this.metricsService = metricsService;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Runs every task and returns results keyed by task key, in task order.
     * A task that throws is mapped through {@code onFailure}; the batch continues.
     * Tasks sharing a key run once.
     */
    public <R> Map<String, R> execute(List<BatchTask<R>> tasks,
                                      Function<Throwable, R> onFailure,
                                      ProgressCallback progress) {
        List<BatchTask<R>> unique = new ArrayList<>(distinct(tasks).values());
        Map<String, R> results = new LinkedHashMap<>();
        int total = unique.size();

        for (int start = 0; start < total; start += windowSize) {
            List<BatchTask<R>> window = unique.subList(start, Math.min(start + windowSize, total));
            metricsService.recordWindowSize(window.size());

            List<CompletableFuture<R>> futures = new ArrayList<>(window.size());
            for (BatchTask<R> task : window) {
                futures.add(CompletableFuture.supplyAsync(task.work(), executor));
            }
            for (int i = 0; i < window.size(); i++) {
                results.put(window.get(i).key(), await(futures.get(i), window.get(i).key(), onFailure));
            }

            int processed = Math.min(start + windowSize, total);
            log.debug("batch.window_completed processed={} total={}", processed, total);
            progress.onProgress(processed, total, null);
        }
        return results;
    }

    /**
     * Like {@link #execute}, but serves hits from {@code cache} without a request and
     * stores fresh results that pass {@code cacheable}. Cache access stays on the
     * calling thread, after each window has completed.
     */
    public <R> Map<String, R> executeCached(List<BatchTask<R>> tasks,
                                            ContentCache<R> cache,
                                            Predicate<R> cacheable,
                                            Function<Throwable, R> onFailure,
                                            ProgressCallback progress) {
        Map<String, R> results = new LinkedHashMap<>();
        List<BatchTask<R>> misses = new ArrayList<>();
        for (BatchTask<R> task : distinct(tasks).values()) {
            Optional<R> cached = cache.get(task.key());
            if (cached.isPresent()) {
                results.put(task.key(), cached.get());
            } else {
                misses.add(task);
            }
        }
        log.debug("batch.cache_checked domain={} total={} misses={}", cache.domain(), results.size() + misses.size(), misses.size());

        Map<String, R> fresh = execute(misses, onFailure, progress);
        for (Map.Entry<String, R> entry : fresh.entrySet()) {
            if (cacheable.test(entry.getValue())) {
                cache.put(entry.getKey(), entry.getValue());
            }
        }
        cache.flush();

        Map<String, R> ordered = new LinkedHashMap<>();
        for (BatchTask<R> task : tasks) {
            R value = results.containsKey(task.key()) ? results.get(task.key()) : fresh.get(task.key());
            ordered.putIfAbsent(task.key(), value);
        }
        return ordered;
    }

    private <R> R await(CompletableFuture<R> future, String key, Function<Throwable, R> onFailure) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("batch.request_failed key={} error={}", key, cause.getMessage());
            return onFailure.apply(cause);
        }
    }

    private static <R> Map<String, BatchTask<R>> distinct(List<BatchTask<R>> tasks) {
        Map<String, BatchTask<R>> byKey = new LinkedHashMap<>();
        for (BatchTask<R> task : tasks) {
            byKey.putIfAbsent(task.key(), task);
        }
        return byKey;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
