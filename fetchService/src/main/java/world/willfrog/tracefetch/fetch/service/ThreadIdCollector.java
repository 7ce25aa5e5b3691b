package world.willfrog.tracefetch.fetch.service;

import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.pojo.run.RawRun;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 从根 run 列表里按出现顺序提取去重后的 thread 标识。
 */
@Component
public class ThreadIdCollector {

    public List<String> collect(List<RawRun> runs, int limit) {
        if (runs == null || limit <= 0) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (RawRun run : runs) {
            if (ids.size() >= limit) {
                break;
            }
            String threadId = threadIdOf(run);
            if (threadId != null) {
                ids.add(threadId);
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * metadata.thread_id 优先，缺失再看 session_id。
     */
    String threadIdOf(RawRun run) {
        if (run == null || run.getExtra() == null || run.getExtra().getMetadata() == null) {
            return null;
        }
        Map<String, Object> metadata = run.getExtra().getMetadata();
        Object value = metadata.get("thread_id");
        if (value == null) {
            value = metadata.get("session_id");
        }
        return asId(value);
    }

    private String asId(Object value) {
        if (value == null || value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
