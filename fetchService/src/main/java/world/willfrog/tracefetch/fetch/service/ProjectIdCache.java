package world.willfrog.tracefetch.fetch.service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 项目名 -> 项目 UUID 的缓存。由调用方持有，测试里每个用例 new 一个即可。
 */
public class ProjectIdCache {

    private final Map<String, String> idsByName = new ConcurrentHashMap<>();

    /**
     * 命中直接返回；未命中时调用 loader，同一名称并发调用只会加载一次。
     * loader 抛异常时不缓存。
     * <p>loader 在 map 的桶锁内执行（一次 /sessions 查询），期间落在同一桶的其他名称会等待；
     * 进程内通常只有一个项目名，不拆成按 key 的 future。</p>
     */
    public String getOrPopulate(String projectName, Supplier<String> loader) {
        return idsByName.computeIfAbsent(projectName, key -> loader.get());
    }

    public Optional<String> peek(String projectName) {
        return Optional.ofNullable(idsByName.get(projectName));
    }
}
