package world.willfrog.tracefetch.fetch.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 有界并发的批量拉取。
 * <p>
 * 职责：
 * 1. 每批新建 min(maxConcurrent, n) 个线程的固定线程池，同时在途的拉取不超过 maxConcurrent；
 * 2. 单个条目失败只记 warn 并从结果中剔除，不影响其他条目；
 * 3. 每个条目结束后回调一次进度，completed 从 1 严格递增到 n；
 * 4. 结果按输入顺序返回，全部条目结束后才返回。
 */
@Component
@Slf4j
public class BulkFetchOrchestrator {

    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    /**
     * @param items          待拉取的条目（通常是 trace / thread id）
     * @param maxConcurrent  并发上限，小于 1 按 1 处理
     * @param fetcher        单条拉取逻辑，抛出的异常视为该条失败
     * @param listener       进度回调，null 表示不关心
     * @param itemKind       日志里的条目类型，如 "trace"
     * @return 成功条目的结果，保持输入顺序
     */
    public <T, R> List<R> fetchAll(List<T> items,
                                   int maxConcurrent,
                                   Function<T, R> fetcher,
                                   ProgressListener listener,
                                   String itemKind) {
        if (items == null || items.isEmpty()) {
            return new ArrayList<>();
        }
        ProgressListener progress = listener == null ? ProgressListener.NOOP : listener;
        int total = items.size();
        int threads = Math.min(Math.max(1, maxConcurrent), total);
        ProgressCounter counter = new ProgressCounter(total, progress);

        ExecutorService pool = Executors.newFixedThreadPool(threads, namedDaemonFactory(itemKind));
        try {
            List<CompletableFuture<Outcome<R>>> futures = new ArrayList<>(total);
            for (T item : items) {
                futures.add(CompletableFuture.supplyAsync(() -> fetchOne(item, fetcher, itemKind, counter), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<R> results = new ArrayList<>(total);
            for (CompletableFuture<Outcome<R>> future : futures) {
                Outcome<R> outcome = future.join();
                if (outcome.success()) {
                    results.add(outcome.value());
                }
            }
            if (results.size() < total) {
                log.info("Fetched {}/{} {}(s), {} failed", results.size(), total, nvl(itemKind), total - results.size());
            }
            return results;
        } finally {
            pool.shutdown();
        }
    }

    private <T, R> Outcome<R> fetchOne(T item, Function<T, R> fetcher, String itemKind, ProgressCounter counter) {
        try {
            return new Outcome<>(true, fetcher.apply(item));
        } catch (Exception e) {
            // 单条失败不外抛，剔除即可
            log.warn("Failed to fetch {} {}: {}", nvl(itemKind), item, describe(e));
            return new Outcome<>(false, null);
        } finally {
            counter.settle();
        }
    }

    private ThreadFactory namedDaemonFactory(String itemKind) {
        String prefix = "bulk-" + (itemKind == null || itemKind.isBlank() ? "fetch" : itemKind)
                + "-" + POOL_SEQ.incrementAndGet() + "-";
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private String nvl(String value) {
        return value == null ? "item" : value;
    }

    private record Outcome<R>(boolean success, R value) {
    }

    /**
     * 计数与回调放在同一把锁里，保证回调看到的 completed 严格递增。
     */
    private static final class ProgressCounter {
        private final int total;
        private final ProgressListener listener;
        private int completed;

        private ProgressCounter(int total, ProgressListener listener) {
            this.total = total;
            this.listener = listener;
        }

        private synchronized void settle() {
            completed++;
            try {
                listener.onProgress(completed, total);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed at {}/{}: {}", completed, total, e.getMessage());
            }
        }
    }
}
