package world.willfrog.tracefetch.fetch.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectIdCacheTest {

    @Test
    void getOrPopulate_shouldLoadOnceUnderConcurrentCallers() throws Exception {
        ProjectIdCache cache = new ProjectIdCache();
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<String>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        start.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return cache.getOrPopulate("proj", () -> {
                        loads.incrementAndGet();
                        return "uuid-1";
                    });
                }, pool));
            }
            start.countDown();
            for (CompletableFuture<String> future : futures) {
                assertEquals("uuid-1", future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, loads.get());
    }

    @Test
    void getOrPopulate_shouldNotCacheFailedLoad() {
        ProjectIdCache cache = new ProjectIdCache();

        assertThrows(IllegalStateException.class, () -> cache.getOrPopulate("proj", () -> {
            throw new IllegalStateException("lookup failed");
        }));
        assertTrue(cache.peek("proj").isEmpty());

        assertEquals("uuid-2", cache.getOrPopulate("proj", () -> "uuid-2"));
        assertEquals(Optional.of("uuid-2"), cache.peek("proj"));
    }
}
