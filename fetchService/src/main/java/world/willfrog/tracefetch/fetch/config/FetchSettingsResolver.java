package world.willfrog.tracefetch.fetch.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.exception.ConfigException;
import world.willfrog.tracefetch.fetch.format.OutputFormat;

import java.util.Optional;

/**
 * 合并环境变量（经 {@link TraceFetchProperties}）与本地配置文件，环境变量优先。
 */
@Component
@RequiredArgsConstructor
public class FetchSettingsResolver {

    private final TraceFetchProperties properties;
    private final LocalConfigLoader localConfigLoader;

    public String apiKey() {
        if (hasText(properties.getApiKey())) {
            return properties.getApiKey().trim();
        }
        Optional<String> local = localConfigLoader.current()
                .map(LocalFetchConfig::getApiKey)
                .filter(this::hasText);
        if (local.isPresent()) {
            return local.get().trim();
        }
        throw new ConfigException("LANGSMITH_API_KEY not found in environment or config. "
                + "Set the LANGSMITH_API_KEY environment variable or store it in " + localConfigLoader.configPath());
    }

    public String baseUrl() {
        String url = hasText(properties.getBaseUrl())
                ? properties.getBaseUrl()
                : localConfigLoader.current()
                .map(LocalFetchConfig::getBaseUrl)
                .filter(this::hasText)
                .orElse(TraceFetchProperties.DEFAULT_BASE_URL);
        url = url.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    public OutputFormat defaultFormat() {
        String configured = hasText(properties.getDefaultFormat())
                ? properties.getDefaultFormat()
                : localConfigLoader.current().map(LocalFetchConfig::getDefaultFormat).orElse(null);
        return OutputFormat.parseOrDefault(configured, OutputFormat.PRETTY);
    }

    /**
     * 配置里显式给出的项目 UUID（环境变量优先，其次本地文件），不做名称解析。
     */
    public Optional<String> configuredProjectUuid() {
        if (hasText(properties.getProjectUuid())) {
            return Optional.of(properties.getProjectUuid().trim());
        }
        return Optional.empty();
    }

    public Optional<String> configuredProjectName() {
        if (hasText(properties.getProjectName())) {
            return Optional.of(properties.getProjectName().trim());
        }
        return localConfigLoader.current()
                .map(LocalFetchConfig::getProjectName)
                .filter(this::hasText)
                .map(String::trim);
    }

    public Optional<String> localProjectUuid() {
        return localConfigLoader.current()
                .map(LocalFetchConfig::getProjectUuid)
                .filter(this::hasText)
                .map(String::trim);
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
