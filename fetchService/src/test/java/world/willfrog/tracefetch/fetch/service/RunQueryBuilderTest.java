package world.willfrog.tracefetch.fetch.service;

import org.junit.jupiter.api.Test;
import world.willfrog.tracefetch.common.exception.ConfigException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RunQueryBuilderTest {

    private final RunQueryBuilder builder = new RunQueryBuilder(
            Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void forTraces_shouldIncludeFilterLimitAndOptionalSession() {
        Map<String, Object> body = builder.forTraces(3, null, TimeWindow.NONE);

        assertEquals(true, body.get("is_root"));
        assertEquals("and(eq(is_root, true), neq(status, \"pending\"))", body.get("filter"));
        assertEquals(3, body.get("limit"));
        assertFalse(body.containsKey("session"));
        assertFalse(body.containsKey("start_time"));

        Map<String, Object> scoped = builder.forTraces(1, "p-1", TimeWindow.of(30, null));
        assertEquals(List.of("p-1"), scoped.get("session"));
        assertEquals("2025-06-01T11:30:00Z", scoped.get("start_time"));
    }

    @Test
    void forThreads_shouldScopeToProjectWithoutLimit() {
        Map<String, Object> body = builder.forThreads("p-1", TimeWindow.of(null, "2025-01-01T00:00:00"));

        assertEquals(List.of("p-1"), body.get("session"));
        assertEquals(true, body.get("is_root"));
        assertEquals("2025-01-01T00:00:00Z", body.get("start_time"));
        assertFalse(body.containsKey("limit"));
        assertFalse(body.containsKey("filter"));
    }

    @Test
    void forThreads_shouldRequireProject() {
        assertThrows(ConfigException.class, () -> builder.forThreads(" ", TimeWindow.NONE));
    }
}
