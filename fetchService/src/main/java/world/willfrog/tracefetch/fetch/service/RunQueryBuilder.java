package world.willfrog.tracefetch.fetch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.exception.ConfigException;
import world.willfrog.tracefetch.common.utils.TimestampUtils;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组装 POST /runs/query 的请求体。
 */
@Component
@RequiredArgsConstructor
public class RunQueryBuilder {

    /** 只取已结束的根 run。 */
    public static final String TRACE_FILTER = "and(eq(is_root, true), neq(status, \"pending\"))";

    private final Clock clock;

    public Map<String, Object> forTraces(int limit, String projectUuid, TimeWindow window) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("is_root", true);
        body.put("filter", TRACE_FILTER);
        body.put("limit", limit);
        if (projectUuid != null && !projectUuid.isBlank()) {
            body.put("session", List.of(projectUuid));
        }
        applyStartTime(body, window);
        return body;
    }

    /**
     * thread 查询不带 limit：需要扫完所有根 run 才能去重出足够的 thread。
     */
    public Map<String, Object> forThreads(String projectUuid, TimeWindow window) {
        if (projectUuid == null || projectUuid.isBlank()) {
            throw new ConfigException("project-uuid required for fetching threads");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session", List.of(projectUuid));
        body.put("is_root", true);
        applyStartTime(body, window);
        return body;
    }

    private void applyStartTime(Map<String, Object> body, TimeWindow window) {
        if (window == null) {
            return;
        }
        window.startTime(clock).ifPresent(start -> body.put("start_time", TimestampUtils.formatInstant(start)));
    }
}
