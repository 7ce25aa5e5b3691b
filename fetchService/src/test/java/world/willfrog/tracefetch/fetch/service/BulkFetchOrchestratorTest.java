package world.willfrog.tracefetch.fetch.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulkFetchOrchestratorTest {

    private final BulkFetchOrchestrator orchestrator = new BulkFetchOrchestrator();

    @Test
    void fetchAll_shouldNeverExceedMaxConcurrent() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> items = IntStream.rangeClosed(1, 12).boxed().collect(Collectors.toList());

        List<Integer> results = orchestrator.fetchAll(items, 3, item -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return item * 10;
        }, null, "trace");

        assertEquals(12, results.size());
        assertTrue(peak.get() <= 3, "peak in-flight was " + peak.get());
        assertEquals(IntStream.rangeClosed(1, 12).map(i -> i * 10).boxed().collect(Collectors.toList()), results);
    }

    @Test
    void fetchAll_shouldOmitFailuresAndKeepInputOrder() {
        List<String> progress = Collections.synchronizedList(new ArrayList<>());

        List<String> results = orchestrator.fetchAll(List.of("A", "B", "C"), 2, item -> {
            if ("B".equals(item)) {
                throw new IllegalStateException("boom");
            }
            return item.toLowerCase();
        }, (completed, total) -> progress.add(completed + "/" + total), "trace");

        assertEquals(List.of("a", "c"), results);
        assertEquals(List.of("1/3", "2/3", "3/3"), progress);
    }

    @Test
    void fetchAll_shouldReportStrictlyIncreasingProgressUnderContention() {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        List<Integer> items = IntStream.range(0, 50).boxed().collect(Collectors.toList());

        orchestrator.fetchAll(items, 8, item -> item, (completed, total) -> seen.add(completed), "thread");

        assertEquals(IntStream.rangeClosed(1, 50).boxed().collect(Collectors.toList()), seen);
    }

    @Test
    void fetchAll_shouldRunSeriallyWhenLimitIsOne() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<String> results = orchestrator.fetchAll(List.of("x", "y", "z"), 1, item -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            inFlight.decrementAndGet();
            return item;
        }, null, "trace");

        assertEquals(List.of("x", "y", "z"), results);
        assertEquals(1, peak.get());
    }

    @Test
    void fetchAll_shouldNotDeadlockWhenLimitExceedsItemCount() throws InterruptedException {
        CountDownLatch bothStarted = new CountDownLatch(2);

        List<String> results = orchestrator.fetchAll(List.of("p", "q"), 10, item -> {
            bothStarted.countDown();
            try {
                // 两个条目必须能同时在途
                assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return item;
        }, null, "trace");

        assertEquals(List.of("p", "q"), results);
        assertTrue(bothStarted.await(0, TimeUnit.SECONDS));
    }

    @Test
    void fetchAll_shouldClampNonPositiveLimitToOne() {
        assertEquals(List.of("only"), orchestrator.fetchAll(List.of("only"), 0, item -> item, null, "trace"));
    }

    @Test
    void fetchAll_shouldSkipEverythingForEmptyInput() {
        AtomicInteger callbacks = new AtomicInteger();

        List<String> results = orchestrator.fetchAll(List.<String>of(), 5, item -> item,
                (completed, total) -> callbacks.incrementAndGet(), "trace");

        assertTrue(results.isEmpty());
        assertEquals(0, callbacks.get());
    }

    @Test
    void fetchAll_shouldSurviveThrowingProgressListener() {
        List<String> results = orchestrator.fetchAll(List.of("a", "b"), 2, item -> item, (completed, total) -> {
            throw new IllegalStateException("listener broke");
        }, "trace");

        assertEquals(List.of("a", "b"), results);
    }
}
