package world.willfrog.tracefetch.fetch.service;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.tracefetch.common.exception.ConfigException;
import world.willfrog.tracefetch.common.pojo.run.ProjectSession;
import world.willfrog.tracefetch.fetch.client.ApiRequest;
import world.willfrog.tracefetch.fetch.client.TraceApiClient;
import world.willfrog.tracefetch.fetch.config.FetchSettingsResolver;

import java.util.List;
import java.util.Optional;

/**
 * 决定本次请求作用于哪个项目。
 * <p>
 * 优先级：
 * 1. 调用方显式传入的 UUID；
 * 2. 配置的项目 UUID（LANGSMITH_PROJECT_UUID）；
 * 3. 配置的项目名（LANGSMITH_PROJECT），经 /sessions 查询后缓存；
 * 4. 本地配置文件里的 project-uuid。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectIdResolver {

    private static final TypeReference<List<ProjectSession>> SESSION_LIST = new TypeReference<>() {
    };

    private final TraceApiClient apiClient;
    private final FetchSettingsResolver settingsResolver;
    private final ProjectIdCache projectIdCache;

    public Optional<String> resolve(String explicitUuid) {
        if (explicitUuid != null && !explicitUuid.isBlank()) {
            return Optional.of(explicitUuid.trim());
        }
        Optional<String> configured = settingsResolver.configuredProjectUuid();
        if (configured.isPresent()) {
            return configured;
        }
        Optional<String> projectName = settingsResolver.configuredProjectName();
        if (projectName.isPresent()) {
            String name = projectName.get();
            return Optional.of(projectIdCache.getOrPopulate(name, () -> lookupProjectId(name)));
        }
        return settingsResolver.localProjectUuid();
    }

    /**
     * 按名称查询项目 UUID，取第一条匹配。
     *
     * @throws ConfigException 没有同名项目
     */
    public String lookupProjectId(String projectName) {
        List<ProjectSession> sessions = apiClient.execute(
                ApiRequest.get("/sessions").withParam("name", projectName), SESSION_LIST);
        if (sessions == null || sessions.isEmpty() || sessions.get(0).getId() == null) {
            throw new ConfigException("Project \"" + projectName + "\" not found");
        }
        String id = sessions.get(0).getId();
        log.debug("Resolved project {} -> {}", projectName, id);
        return id;
    }
}
